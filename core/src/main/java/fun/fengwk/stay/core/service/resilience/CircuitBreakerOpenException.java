package fun.fengwk.stay.core.service.resilience;

/**
 * Thrown when a call is rejected without invoking the guarded operation.
 *
 * @author fengwk
 */
public class CircuitBreakerOpenException extends RuntimeException {

    public CircuitBreakerOpenException(String name) {
        super("circuit breaker is open: " + name);
    }

}
