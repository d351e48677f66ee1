package fun.fengwk.stay.core.service.resilience;

/**
 * Circuit breaker states.
 *
 * @author fengwk
 */
public enum CircuitState {

    /**
     * Calls pass through, failures are counted.
     */
    CLOSED,

    /**
     * Calls are rejected until the recovery timeout elapses.
     */
    OPEN,

    /**
     * A single trial call is in flight.
     */
    HALF_OPEN

}
