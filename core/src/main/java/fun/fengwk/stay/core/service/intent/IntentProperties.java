package fun.fengwk.stay.core.service.intent;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Query interpretation configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "stay.intent")
public class IntentProperties {

    /**
     * Location used when the query names none.
     */
    private String defaultLocation = "San Francisco";

    /**
     * Max number of locations kept in one intent.
     */
    private int maxLocations = 10;

    /**
     * Upper bound of the guest count.
     */
    private int maxGuests = 16;

}
