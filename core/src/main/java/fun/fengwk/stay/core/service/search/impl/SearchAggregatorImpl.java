package fun.fengwk.stay.core.service.search.impl;

import fun.fengwk.stay.core.facade.listing.ListingProviderClient;
import fun.fengwk.stay.core.facade.listing.model.ListingSearchFilters;
import fun.fengwk.stay.core.facade.listing.model.RawListing;
import fun.fengwk.stay.core.service.geo.GeoResolver;
import fun.fengwk.stay.core.service.intent.IntentExtractor;
import fun.fengwk.stay.core.service.intent.QuerySanitizer;
import fun.fengwk.stay.core.service.intent.model.SearchIntent;
import fun.fengwk.stay.core.service.intent.model.SortDirective;
import fun.fengwk.stay.core.service.normalize.ResultNormalizer;
import fun.fengwk.stay.core.service.resilience.CircuitBreaker;
import fun.fengwk.stay.core.service.resilience.CircuitState;
import fun.fengwk.stay.core.service.search.SearchAggregator;
import fun.fengwk.stay.core.service.search.SearchProperties;
import fun.fengwk.stay.core.service.search.model.Property;
import fun.fengwk.stay.core.service.search.model.SearchCriteria;
import fun.fengwk.stay.core.service.search.model.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchAggregatorImpl implements SearchAggregator {

    private final QuerySanitizer querySanitizer;
    private final IntentExtractor intentExtractor;
    private final GeoResolver geoResolver;
    private final ListingProviderClient listingProviderClient;
    private final ResultNormalizer resultNormalizer;
    private final CircuitBreaker circuitBreaker;
    private final SearchProperties searchProperties;

    @Override
    public SearchResponse aggregate(String rawQuery, LocalDate checkin, LocalDate checkout) {
        long startNanos = System.nanoTime();

        String query;
        SearchIntent intent;
        try {
            query = querySanitizer.sanitize(rawQuery);
            intent = intentExtractor.extract(query);
        } catch (IllegalArgumentException ex) {
            log.info("search rejected, error={}", ex.getMessage());
            return failure("Invalid search request.", ex.getMessage(), startNanos);
        } catch (RuntimeException ex) {
            log.error("search failed while parsing query", ex);
            return failure("Search failed, please try again.", ex.getMessage(), startNanos);
        }

        List<String> locations = intent.getLocations().stream()
            .limit(Math.max(1, searchProperties.getMaxLocations()))
            .toList();
        ListingSearchFilters filters = ListingSearchFilters.builder()
            .adults(intent.getGuests())
            .checkin(checkin)
            .checkout(checkout)
            .priceMin(intent.getPriceMin())
            .priceMax(intent.getPriceMax())
            .build();

        List<RawListing> raws = searchAll(locations, filters);

        List<Property> properties = dedupe(resultNormalizer.normalizeAll(raws));
        sort(properties, intent.getSortBy());
        if (properties.size() > searchProperties.getMaxResults()) {
            properties = new ArrayList<>(properties.subList(0, Math.max(0, searchProperties.getMaxResults())));
        }

        List<String> unresolved = locations.stream()
            .filter(location -> !geoResolver.isKnown(location))
            .toList();

        SearchResponse response = SearchResponse.builder()
            .success(true)
            .properties(Collections.unmodifiableList(properties))
            .total(properties.size())
            .query(query)
            .locations(locations)
            .unresolvedLocations(unresolved)
            .criteria(toCriteria(intent))
            .message(buildMessage(properties.size(), locations))
            .processingTimeMs(elapsedMillis(startNanos))
            .build();
        log.info("search done, query={}, locations={}, raw={}, returned={}, costMs={}",
            query, locations, raws.size(), response.getTotal(), response.getProcessingTimeMs());
        return response;
    }

    private List<RawListing> searchOne(String location, ListingSearchFilters filters) {
        return tag(listingProviderClient.search(location, filters), location);
    }

    /**
     * Fan out over a per-request pool, collecting in completion order until the deadline. A single
     * location runs on a one-worker pool so the same deadline applies.
     */
    private List<RawListing> searchAll(List<String> locations, ListingSearchFilters filters) {
        int workers = Math.max(1, Math.min(searchProperties.getWorkerConcurrency(), locations.size()));
        ExecutorService executor = Executors.newFixedThreadPool(workers, new SearchWorkerThreadFactory());
        List<RawListing> collected = new ArrayList<>();
        try {
            CompletionService<List<RawListing>> completionService = new ExecutorCompletionService<>(executor);
            for (String location : locations) {
                completionService.submit(() -> searchOne(location, filters));
            }

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(searchProperties.getRequestTimeoutMs());
            for (int received = 0; received < locations.size(); received++) {
                long remaining = deadline - System.nanoTime();
                Future<List<RawListing>> future = remaining > 0
                    ? completionService.poll(remaining, TimeUnit.NANOSECONDS)
                    : null;
                if (future == null) {
                    log.warn("search deadline reached, completed={}, pending={}",
                        received, locations.size() - received);
                    break;
                }
                try {
                    collected.addAll(future.get());
                } catch (ExecutionException ex) {
                    log.warn("location search failed, error={}", String.valueOf(ex.getCause()));
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("search interrupted, returning partial results, collected={}", collected.size());
        } finally {
            executor.shutdownNow();
        }
        return collected;
    }

    private static List<RawListing> tag(List<RawListing> raws, String location) {
        if (raws == null || raws.isEmpty()) {
            return Collections.emptyList();
        }
        for (RawListing raw : raws) {
            raw.setSourceLocation(location);
        }
        return raws;
    }

    /**
     * Keep the first occurrence of each id.
     */
    private static List<Property> dedupe(List<Property> properties) {
        Set<String> seen = new HashSet<>();
        List<Property> unique = new ArrayList<>(properties.size());
        for (Property property : properties) {
            if (seen.add(property.getId())) {
                unique.add(property);
            }
        }
        return unique;
    }

    private static void sort(List<Property> properties, SortDirective sortBy) {
        if (sortBy == SortDirective.PRICE_ASC) {
            properties.sort(Comparator.comparingInt(Property::getPrice));
        } else if (sortBy == SortDirective.PRICE_DESC) {
            properties.sort(Comparator.comparingInt(Property::getPrice).reversed());
        }
    }

    private static SearchCriteria toCriteria(SearchIntent intent) {
        return SearchCriteria.builder()
            .sortBy(intent.getSortBy().getCode())
            .propertySize(intent.getPropertySize().getCode())
            .priceMin(intent.getPriceMin())
            .priceMax(intent.getPriceMax())
            .bedrooms(intent.getBedrooms())
            .guests(intent.getGuests())
            .propertyType(intent.getPropertyType())
            .build();
    }

    private String buildMessage(int count, List<String> locations) {
        String where = String.join(", ", locations);
        String message = count > 0
            ? "Found " + count + (count == 1 ? " property" : " properties") + " in " + where + "."
            : "No properties found in " + where + ". Try a different location or fewer filters.";
        if (circuitBreaker.getState() != CircuitState.CLOSED) {
            message += " The listings provider is currently degraded, results may be incomplete.";
        }
        return message;
    }

    private static SearchResponse failure(String message, String error, long startNanos) {
        return SearchResponse.builder()
            .success(false)
            .message(message)
            .error(error)
            .processingTimeMs(elapsedMillis(startNanos))
            .build();
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static class SearchWorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger ID_GEN = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("stay-search-worker-" + ID_GEN.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }

    }

}
