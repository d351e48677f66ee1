package fun.fengwk.stay.core.service.resilience;

import java.time.Duration;

/**
 * Immutable exponential backoff plan.
 *
 * @param maxRetries total number of attempts, at least 1
 * @param baseDelay  delay after the first failed attempt
 * @param maxDelay   upper bound of any single delay
 * @author fengwk
 */
public record RetryPlan(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public RetryPlan {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
    }

}
