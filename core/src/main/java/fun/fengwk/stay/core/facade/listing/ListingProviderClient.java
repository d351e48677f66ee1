package fun.fengwk.stay.core.facade.listing;

import fun.fengwk.stay.core.facade.listing.model.ListingSearchFilters;
import fun.fengwk.stay.core.facade.listing.model.RawListing;

import java.util.List;

/**
 * @author fengwk
 */
public interface ListingProviderClient {

    /**
     * Search listings for one location.
     *
     * @return provider records, empty when the location is invalid or the provider failed
     */
    List<RawListing> search(String location, ListingSearchFilters filters);

}
