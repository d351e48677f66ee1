package fun.fengwk.stay.core.service.search.model;

import lombok.Builder;
import lombok.Data;

/**
 * Criteria resolved from the query, echoed back to the caller.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchCriteria {

    private String sortBy;
    private String propertySize;
    private Integer priceMin;
    private Integer priceMax;
    private Integer bedrooms;
    private int guests;
    private String propertyType;

}
