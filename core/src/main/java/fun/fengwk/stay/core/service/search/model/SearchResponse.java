package fun.fengwk.stay.core.service.search.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class SearchResponse {

    private boolean success;

    @Builder.Default
    private List<Property> properties = List.of();

    /**
     * Number of properties returned.
     */
    private int total;

    /**
     * Sanitized query.
     */
    private String query;

    @Builder.Default
    private List<String> locations = List.of();

    /**
     * Locations searched in the default area because no mapping was found.
     */
    @Builder.Default
    private List<String> unresolvedLocations = List.of();

    private SearchCriteria criteria;
    private long processingTimeMs;
    private String message;
    private String error;

    /**
     * Filled by the result enhancer only.
     */
    private String aiSummary;

    @Builder.Default
    private List<String> matchReasons = List.of();

}
