package fun.fengwk.stay.core.service.search;

import fun.fengwk.stay.core.service.search.model.SearchResponse;

import java.time.LocalDate;

/**
 * Turns a natural-language query into a ranked, size-capped property list.
 *
 * @author fengwk
 */
public interface SearchAggregator {

    default SearchResponse aggregate(String rawQuery) {
        return aggregate(rawQuery, null, null);
    }

    /**
     * @param checkin  optional check-in date
     * @param checkout optional check-out date
     */
    SearchResponse aggregate(String rawQuery, LocalDate checkin, LocalDate checkout);

}
