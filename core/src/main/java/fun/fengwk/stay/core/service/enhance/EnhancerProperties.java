package fun.fengwk.stay.core.service.enhance;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "stay.enhancer")
public class EnhancerProperties {

    /**
     * Whether to call the chat model at all.
     */
    private boolean enabled = false;

    /**
     * Budget for one chat model call, in milliseconds.
     */
    private long timeoutMs = 15000;

    /**
     * Max suggestions returned.
     */
    private int maxSuggestions = 5;

    /**
     * Max match reasons kept from the summary.
     */
    private int maxMatchReasons = 3;

}
