package fun.fengwk.stay.core.service.search;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "stay.search")
public class SearchProperties {

    /**
     * Max properties per response.
     */
    private int maxResults = 5;

    /**
     * Max locations searched per request.
     */
    private int maxLocations = 10;

    /**
     * Max concurrent provider calls per request.
     */
    private int workerConcurrency = 5;

    /**
     * Whole-request deadline for multi-location searches, in milliseconds.
     */
    private long requestTimeoutMs = 30000;

    /**
     * Listing url prefix, the listing id is appended.
     */
    private String listingBaseUrl = "https://www.airbnb.com/rooms/";

    /**
     * Image used when a listing has no usable picture.
     */
    private String placeholderImageUrl = "https://images.unsplash.com/photo-1564013799919-ab600027ffc6?w=800";

}
