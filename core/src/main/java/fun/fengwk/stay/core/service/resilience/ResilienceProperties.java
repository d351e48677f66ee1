package fun.fengwk.stay.core.service.resilience;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Circuit breaker and retry configuration for the listing provider call path.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "stay.resilience")
public class ResilienceProperties {

    /**
     * Failures in CLOSED state before the breaker opens.
     */
    private int failureThreshold = 5;

    /**
     * Time the breaker stays open before admitting a trial call, in milliseconds.
     */
    private long recoveryTimeoutMs = 60000;

    /**
     * Total attempts per provider call.
     */
    private int maxRetries = 3;

    /**
     * Backoff after the first failed attempt, in milliseconds.
     */
    private long baseDelayMs = 1000;

    /**
     * Backoff upper bound, in milliseconds.
     */
    private long maxDelayMs = 10000;

    public RetryPlan toRetryPlan() {
        return new RetryPlan(maxRetries, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs));
    }

}
