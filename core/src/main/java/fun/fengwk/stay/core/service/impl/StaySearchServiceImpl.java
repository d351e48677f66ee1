package fun.fengwk.stay.core.service.impl;

import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiProperties;
import fun.fengwk.stay.core.service.StaySearchService;
import fun.fengwk.stay.core.service.enhance.ResultEnhancer;
import fun.fengwk.stay.core.service.geo.GeoResolver;
import fun.fengwk.stay.core.service.geo.SupportedLocation;
import fun.fengwk.stay.core.service.model.HealthStatus;
import fun.fengwk.stay.core.service.resilience.CircuitBreaker;
import fun.fengwk.stay.core.service.resilience.CircuitState;
import fun.fengwk.stay.core.service.search.SearchAggregator;
import fun.fengwk.stay.core.service.search.model.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaySearchServiceImpl implements StaySearchService {

    private final SearchAggregator searchAggregator;
    private final ResultEnhancer resultEnhancer;
    private final GeoResolver geoResolver;
    private final CircuitBreaker circuitBreaker;
    private final RapidApiProperties rapidApiProperties;

    @Override
    public SearchResponse search(String query, String checkin, String checkout) {
        LocalDate checkinDate;
        LocalDate checkoutDate;
        try {
            checkinDate = parseDate(checkin, "checkin");
            checkoutDate = parseDate(checkout, "checkout");
        } catch (IllegalArgumentException ex) {
            return SearchResponse.builder()
                .success(false)
                .query(query)
                .message("Invalid search request.")
                .error(ex.getMessage())
                .build();
        }
        if (checkinDate != null && checkoutDate != null && !checkoutDate.isAfter(checkinDate)) {
            return SearchResponse.builder()
                .success(false)
                .query(query)
                .message("Invalid search request.")
                .error("checkout must be after checkin")
                .build();
        }

        SearchResponse response = searchAggregator.aggregate(query, checkinDate, checkoutDate);
        if (response.isSuccess() && !response.getProperties().isEmpty()) {
            resultEnhancer.summarize(response.getQuery(), response.getProperties()).ifPresent(summary -> {
                response.setAiSummary(summary.summary());
                response.setMatchReasons(summary.matchReasons());
            });
        }
        return response;
    }

    @Override
    public List<SupportedLocation> supportedLocations() {
        return geoResolver.supportedLocations();
    }

    @Override
    public HealthStatus health() {
        CircuitState state = circuitBreaker.getState();
        return HealthStatus.builder()
            .status(state == CircuitState.CLOSED ? "healthy" : "degraded")
            .providerCircuit(state.name().toLowerCase(Locale.ROOT))
            .providerFailureCount(circuitBreaker.getFailureCount())
            .providerConfigured(StringUtils.isNotBlank(rapidApiProperties.getApiKey()))
            .enhancerAvailable(resultEnhancer.isAvailable())
            .build();
    }

    @Override
    public List<String> suggestions(String partialQuery) {
        return resultEnhancer.suggest(partialQuery);
    }

    private static LocalDate parseDate(String value, String name) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(name + " must be an ISO date (yyyy-MM-dd): " + value, ex);
        }
    }

}
