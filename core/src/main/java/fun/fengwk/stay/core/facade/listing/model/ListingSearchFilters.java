package fun.fengwk.stay.core.facade.listing.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Optional provider-side filters for one location search.
 *
 * @author fengwk
 */
@Data
@Builder
public class ListingSearchFilters {

    @Builder.Default
    private int adults = 2;

    private int children;

    private int infants;

    private int pets;

    /**
     * Check-in date, null means flexible.
     */
    private LocalDate checkin;

    /**
     * Check-out date, null means flexible.
     */
    private LocalDate checkout;

    private Integer priceMin;

    private Integer priceMax;

}
