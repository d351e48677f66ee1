package fun.fengwk.stay.core.facade.listing.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.stay.core.facade.listing.ListingProviderClient;
import fun.fengwk.stay.core.facade.listing.ListingProviderException;
import fun.fengwk.stay.core.facade.listing.model.ListingSearchFilters;
import fun.fengwk.stay.core.facade.listing.model.RawListing;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiClient;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiClientResponse;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiProperties;
import fun.fengwk.stay.core.service.geo.GeoResolution;
import fun.fengwk.stay.core.service.geo.GeoResolver;
import fun.fengwk.stay.core.service.resilience.CircuitBreaker;
import fun.fengwk.stay.core.service.resilience.ResilienceProperties;
import fun.fengwk.stay.core.service.resilience.RetryExecutor;
import fun.fengwk.stay.core.utils.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider client guarded by retry (outside) and the circuit breaker (inside).
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ListingProviderClientImpl implements ListingProviderClient {

    /**
     * Max accepted location length.
     */
    private static final int MAX_LOCATION_LENGTH = 100;

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final RapidApiClient rapidApiClient;
    private final RapidApiProperties rapidApiProperties;
    private final GeoResolver geoResolver;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final ResilienceProperties resilienceProperties;
    private final ObjectMapper objectMapper;

    @Override
    public List<RawListing> search(String location, ListingSearchFilters filters) {
        if (!isValidLocation(location)) {
            log.warn("invalid location skipped, location={}", location);
            return Collections.emptyList();
        }

        GeoResolution resolution = geoResolver.resolve(location);
        Map<String, String> params = buildParams(resolution.areaId(), filters == null
            ? ListingSearchFilters.builder().build()
            : filters);

        String body;
        try {
            body = retryExecutor.runWithRetry(
                () -> circuitBreaker.execute(() -> fetch(params)),
                resilienceProperties.toRetryPlan());
        } catch (InterruptedException | BackOffInterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("provider search cancelled, location={}", location);
            return Collections.emptyList();
        } catch (Exception ex) {
            log.warn("provider search failed, location={}, areaId={}, error={}",
                location, resolution.areaId(), ex.getMessage());
            return Collections.emptyList();
        }

        return parseListings(location, body);
    }

    /**
     * One guarded attempt, any non-2xx answer counts as a failure.
     */
    private String fetch(Map<String, String> params) throws InterruptedException {
        RapidApiClientResponse response = rapidApiClient.search(params);
        if (response.hasError()) {
            throw new ListingProviderException("provider request failed: "
                + response.getError().getMessage(), response.getError());
        }
        if (response.getStatusCode() == 429) {
            throw new ListingProviderException("provider rate limited", 429);
        }
        if (!response.isSuccessful()) {
            throw new ListingProviderException("provider returned status " + response.getStatusCode(),
                response.getStatusCode());
        }
        return response.getBody();
    }

    private Map<String, String> buildParams(String areaId, ListingSearchFilters filters) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("placeId", areaId);
        params.put("adults", String.valueOf(Math.max(1, filters.getAdults())));
        params.put("children", String.valueOf(Math.max(0, filters.getChildren())));
        params.put("infants", String.valueOf(Math.max(0, filters.getInfants())));
        params.put("pets", String.valueOf(Math.max(0, filters.getPets())));
        params.put("currency", StringUtils.defaultIfBlank(rapidApiProperties.getCurrency(), "USD"));
        if (filters.getCheckin() != null) {
            params.put("checkin", filters.getCheckin().toString());
        }
        if (filters.getCheckout() != null) {
            params.put("checkout", filters.getCheckout().toString());
        }
        if (filters.getPriceMin() != null) {
            params.put("priceMin", String.valueOf(filters.getPriceMin()));
        }
        if (filters.getPriceMax() != null) {
            params.put("priceMax", String.valueOf(filters.getPriceMax()));
        }
        return params;
    }

    private List<RawListing> parseListings(String location, String body) {
        if (StringUtils.isBlank(body)) {
            log.warn("provider returned empty body, location={}", location);
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            log.warn("provider returned malformed json, location={}, error={}", location, ex.getMessage());
            return Collections.emptyList();
        }

        JsonNode records = locateRecords(root);
        if (records == null) {
            log.warn("provider returned unexpected shape, location={}, body={}",
                location, TextUtils.truncate(body, 200));
            return Collections.emptyList();
        }

        List<RawListing> listings = new ArrayList<>();
        for (JsonNode record : records) {
            if (!record.isObject()) {
                log.debug("non-object provider record skipped, location={}", location);
                continue;
            }
            Map<String, Object> fields = objectMapper.convertValue(record, DOCUMENT_TYPE);
            listings.add(RawListing.of(fields));
        }
        log.debug("provider search done, location={}, records={}", location, listings.size());
        return listings;
    }

    /**
     * Accepts {@code {"data": [...]}} and {@code {"data": {"list": [...]}}}.
     */
    private static JsonNode locateRecords(JsonNode root) {
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode status = root.get("status");
        if (status != null && status.isBoolean() && !status.booleanValue()) {
            return null;
        }
        JsonNode data = root.get("data");
        if (data == null) {
            return null;
        }
        if (data.isArray()) {
            return data;
        }
        if (data.isObject()) {
            JsonNode list = data.get("list");
            if (list != null && list.isArray()) {
                return list;
            }
        }
        return null;
    }

    private static boolean isValidLocation(String location) {
        if (StringUtils.isBlank(location)) {
            return false;
        }
        String trimmed = location.trim();
        return trimmed.length() <= MAX_LOCATION_LENGTH && TextUtils.containsLetter(trimmed);
    }

}
