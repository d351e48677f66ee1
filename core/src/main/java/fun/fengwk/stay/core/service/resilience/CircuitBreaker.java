package fun.fengwk.stay.core.service.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Count based circuit breaker guarding one logical call path, backed by resilience4j.
 *
 * <p>State transitions:
 * <ul>
 *     <li>CLOSED: failures are counted, reaching the threshold opens the breaker. Successes are not
 *     recorded, so they never dilute the failure count.</li>
 *     <li>OPEN: calls are rejected until the recovery timeout has elapsed since the breaker opened,
 *     then exactly one trial call is admitted and the breaker becomes HALF_OPEN.</li>
 *     <li>HALF_OPEN: trial success closes the breaker, trial failure opens it again.</li>
 * </ul>
 *
 * <p>Interruption and cancellation of the caller are not failures of the guarded path.
 *
 * @author fengwk
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(recoveryTimeout)
            .permittedNumberOfCallsInHalfOpenState(1)
            .ignoreExceptions(InterruptedException.class, CancellationException.class)
            .build();
        this.name = name;
        this.delegate = new CircuitBreakerStateMachine(name, config, clock);
        this.delegate.getEventPublisher().onStateTransition(event -> log.info(
            "circuit breaker state changed, name={}, transition={}", name, event.getStateTransition()));
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        if (!delegate.tryAcquirePermission()) {
            throw new CircuitBreakerOpenException(name);
        }
        long start = System.nanoTime();
        try {
            T result = operation.call();
            onSuccess(System.nanoTime() - start);
            return result;
        } catch (Exception ex) {
            if (Thread.currentThread().isInterrupted()) {
                delegate.releasePermission();
            } else {
                delegate.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, ex);
            }
            throw ex;
        } catch (Throwable ex) {
            delegate.releasePermission();
            throw ex;
        }
    }

    public CircuitState getState() {
        switch (delegate.getState()) {
            case CLOSED:
            case DISABLED:
            case METRICS_ONLY:
                return CircuitState.CLOSED;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.OPEN;
        }
    }

    public int getFailureCount() {
        return delegate.getMetrics().getNumberOfFailedCalls();
    }

    public String getName() {
        return name;
    }

    private void onSuccess(long durationNanos) {
        if (delegate.getState() == io.github.resilience4j.circuitbreaker.CircuitBreaker.State.HALF_OPEN) {
            delegate.onSuccess(durationNanos, TimeUnit.NANOSECONDS);
        } else {
            delegate.releasePermission();
        }
    }

}
