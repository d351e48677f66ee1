package fun.fengwk.stay.core.facade.listing.rapidapi;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * RapidAPI listings provider configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "stay.provider.rapidapi")
public class RapidApiProperties {

    /**
     * Provider base url.
     */
    private String baseUrl = "https://airbnb19.p.rapidapi.com";

    /**
     * Value of the X-RapidAPI-Host header.
     */
    private String host = "airbnb19.p.rapidapi.com";

    /**
     * Value of the X-RapidAPI-Key header.
     */
    private String apiKey = "";

    /**
     * Search endpoint path.
     */
    private String searchPath = "/api/v2/searchPropertyByPlaceId";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 10000;

    /**
     * Currency requested from the provider.
     */
    private String currency = "USD";

    /**
     * User agent identifying this service.
     */
    private String userAgent = "stay-search-hub/1.0";

}
