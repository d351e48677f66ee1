package fun.fengwk.stay.core.configuration;

import fun.fengwk.stay.core.service.resilience.CircuitBreaker;
import fun.fengwk.stay.core.service.resilience.ResilienceProperties;
import fun.fengwk.stay.core.service.resilience.RetryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Process-wide breaker and retry executor for the listings provider.
 *
 * @author fengwk
 */
@Configuration
public class ResilienceConfiguration {

    @Bean
    public CircuitBreaker listingCircuitBreaker(ResilienceProperties resilienceProperties) {
        return new CircuitBreaker(
            "listing-provider",
            resilienceProperties.getFailureThreshold(),
            Duration.ofMillis(resilienceProperties.getRecoveryTimeoutMs()));
    }

    @Bean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }

}
