package fun.fengwk.stay.core.service.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs an operation with bounded, deterministic exponential backoff on a Spring {@link RetryTemplate}.
 *
 * @author fengwk
 */
@Slf4j
public class RetryExecutor {

    private static final Map<Class<? extends Throwable>, Boolean> RETRYABLE = Map.of(
        InterruptedException.class, false,
        Exception.class, true
    );

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(new ThreadWaitSleeper());
    }

    RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Invoke the operation until it succeeds or {@code plan.maxRetries()} attempts have failed,
     * in which case the last failure is rethrown. Interruption is never retried.
     */
    public <T> T runWithRetry(Callable<T> operation, RetryPlan plan) throws Exception {
        return buildTemplate(plan).execute(context -> {
            if (context.getRetryCount() > 0) {
                log.debug("attempt failed, retrying, attempt={}, error={}",
                    context.getRetryCount() + 1, String.valueOf(context.getLastThrowable()));
            }
            try {
                return operation.call();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw ex;
            }
        });
    }

    private RetryTemplate buildTemplate(RetryPlan plan) {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(plan.baseDelay().toMillis());
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(plan.maxDelay().toMillis());
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(plan.maxRetries(), RETRYABLE, false, false));
        template.setBackOffPolicy(backOffPolicy);
        template.setThrowLastExceptionOnExhausted(true);
        return template;
    }

}
