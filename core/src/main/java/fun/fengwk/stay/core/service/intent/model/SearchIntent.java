package fun.fengwk.stay.core.service.intent.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Structured interpretation of a free-text search query.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchIntent {

    /**
     * Locations to search, never empty, deduplicated, at most the configured maximum.
     */
    private List<String> locations;

    @Builder.Default
    private SortDirective sortBy = SortDirective.NONE;

    @Builder.Default
    private SizePreference propertySize = SizePreference.NONE;

    /**
     * Lower price bound, null when not stated.
     */
    private Integer priceMin;

    /**
     * Upper price bound, null when not stated.
     */
    private Integer priceMax;

    /**
     * Bedroom count, null when not stated.
     */
    private Integer bedrooms;

    /**
     * Guest count, explicit or derived from bedrooms.
     */
    @Builder.Default
    private int guests = 2;

    /**
     * Sanitized property type hint, e.g. house or apartment.
     */
    private String propertyType;

}
