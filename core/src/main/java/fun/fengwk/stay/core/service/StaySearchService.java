package fun.fengwk.stay.core.service;

import fun.fengwk.stay.core.service.geo.SupportedLocation;
import fun.fengwk.stay.core.service.model.HealthStatus;
import fun.fengwk.stay.core.service.search.model.SearchResponse;

import java.util.List;

/**
 * @author fengwk
 */
public interface StaySearchService {

    /**
     * @param checkin  ISO date, optional
     * @param checkout ISO date, optional
     */
    SearchResponse search(String query, String checkin, String checkout);

    List<SupportedLocation> supportedLocations();

    HealthStatus health();

    List<String> suggestions(String partialQuery);

}
