package fun.fengwk.stay.core.service.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class HealthStatus {

    /**
     * healthy or degraded.
     */
    private String status;

    /**
     * Breaker state of the listings provider call path.
     */
    private String providerCircuit;

    private int providerFailureCount;

    private boolean providerConfigured;

    private boolean enhancerAvailable;

}
