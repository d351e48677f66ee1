package fun.fengwk.stay.core.service.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.stay.core.facade.listing.ListingProviderClient;
import fun.fengwk.stay.core.facade.listing.impl.ListingProviderClientImpl;
import fun.fengwk.stay.core.facade.listing.model.ListingSearchFilters;
import fun.fengwk.stay.core.facade.listing.model.RawListing;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiClient;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiProperties;
import fun.fengwk.stay.core.service.geo.GeoResolver;
import fun.fengwk.stay.core.service.intent.IntentExtractor;
import fun.fengwk.stay.core.service.intent.IntentProperties;
import fun.fengwk.stay.core.service.intent.QuerySanitizer;
import fun.fengwk.stay.core.service.normalize.ResultNormalizer;
import fun.fengwk.stay.core.service.resilience.CircuitBreaker;
import fun.fengwk.stay.core.service.resilience.CircuitState;
import fun.fengwk.stay.core.service.resilience.ResilienceProperties;
import fun.fengwk.stay.core.service.resilience.RetryExecutor;
import fun.fengwk.stay.core.service.search.SearchProperties;
import fun.fengwk.stay.core.service.search.model.Property;
import fun.fengwk.stay.core.service.search.model.SearchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SearchAggregatorImpl tests.
 *
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class SearchAggregatorImplTest {

    @Mock
    private ListingProviderClient listingProviderClient;

    private SearchProperties searchProperties;
    private CircuitBreaker circuitBreaker;
    private SearchAggregatorImpl searchAggregator;

    @BeforeEach
    void setUp() {
        searchProperties = new SearchProperties();
        circuitBreaker = new CircuitBreaker("test", 1, Duration.ofSeconds(60));
        searchAggregator = new SearchAggregatorImpl(
            new QuerySanitizer(),
            new IntentExtractor(new IntentProperties()),
            new GeoResolver(),
            listingProviderClient,
            new ResultNormalizer(searchProperties),
            circuitBreaker,
            searchProperties);
    }

    @Test
    void shouldRejectBlankQueryWithoutCallingProvider() {
        SearchResponse response = searchAggregator.aggregate("   ");

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError()).isEqualTo("query is blank");
        assertThat(response.getProperties()).isEmpty();
        verify(listingProviderClient, never()).search(anyString(), any());
    }

    @Test
    void shouldReturnEmptySuccessForMalformedRecords() {
        Map<String, Object> nullId = new HashMap<>();
        nullId.put("id", null);
        when(listingProviderClient.search(eq("Miami"), any())).thenAnswer(invocation -> List.of(
            RawListing.of(Map.of("listing", nullId)),
            RawListing.of(Map.of("invalid", "structure"))));

        SearchResponse response = searchAggregator.aggregate("Find a 3 bedroom house in Miami under $300");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getProperties()).isEmpty();
        assertThat(response.getTotal()).isZero();
        assertThat(response.getLocations()).containsExactly("Miami");
        assertThat(response.getMessage()).startsWith("No properties found");
        assertThat(response.getCriteria().getPriceMax()).isEqualTo(300);
        assertThat(response.getCriteria().getGuests()).isEqualTo(6);
    }

    @Test
    void shouldPassIntentAndDatesAsFilters() {
        when(listingProviderClient.search(eq("Miami"), any())).thenAnswer(invocation -> List.of());

        searchAggregator.aggregate("house in Miami for 4 guests over $150",
            LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 5));

        ArgumentCaptor<ListingSearchFilters> filtersCaptor = ArgumentCaptor.forClass(ListingSearchFilters.class);
        verify(listingProviderClient).search(eq("Miami"), filtersCaptor.capture());
        ListingSearchFilters filters = filtersCaptor.getValue();
        assertThat(filters.getAdults()).isEqualTo(4);
        assertThat(filters.getPriceMin()).isEqualTo(150);
        assertThat(filters.getPriceMax()).isNull();
        assertThat(filters.getCheckin()).isEqualTo(LocalDate.of(2024, 7, 1));
        assertThat(filters.getCheckout()).isEqualTo(LocalDate.of(2024, 7, 5));
    }

    @Test
    void shouldDedupeSortAndTruncate() {
        when(listingProviderClient.search(eq("Tokyo"), any())).thenAnswer(invocation -> List.of(
            listing("a", 300), listing("b", 120), listing("c", 90), listing("b", 10),
            listing("d", 250), listing("e", 120), listing("f", 500), listing("g", 60)));

        SearchResponse response = searchAggregator.aggregate("cheapest apartment in Tokyo");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getProperties())
            .extracting(Property::getId)
            .containsExactly("g", "c", "b", "e", "d");
        assertThat(response.getTotal()).isEqualTo(5);
        assertThat(response.getProperties()).allSatisfy(property ->
            assertThat(property.getSourceLocation()).isEqualTo("Tokyo"));
        assertThat(response.getMessage()).startsWith("Found 5 properties");
    }

    @Test
    void shouldSortDescendingForLuxuryQueries() {
        when(listingProviderClient.search(eq("Paris"), any())).thenAnswer(invocation -> List.of(
            listing("a", 100), listing("b", 900), listing("c", 400)));

        SearchResponse response = searchAggregator.aggregate("luxury loft in Paris");

        assertThat(response.getProperties()).extracting(Property::getPrice).containsExactly(900, 400, 100);
    }

    @Test
    void shouldIsolateFailingLocations() {
        when(listingProviderClient.search(anyString(), any())).thenAnswer(invocation -> {
            String location = invocation.getArgument(0);
            return switch (location) {
                case "London" -> throw new IllegalStateException("boom");
                case "Paris" -> List.of();
                default -> List.of(listing(location + "-1", 100), listing(location + "-2", 200));
            };
        });

        SearchResponse response = searchAggregator.aggregate("Cheapest large homes globally");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getLocations()).containsExactly("New York", "London", "Paris", "Tokyo", "Sydney");
        assertThat(response.getProperties()).hasSize(5);
        assertThat(response.getProperties()).extracting(Property::getSourceLocation)
            .doesNotContain("London", "Paris");
        assertThat(response.getProperties()).extracting(Property::getPrice)
            .containsExactly(100, 100, 100, 200, 200);
    }

    @Test
    void shouldReturnPartialResultsWhenDeadlineExpires() {
        searchProperties.setRequestTimeoutMs(300);
        CountDownLatch release = new CountDownLatch(1);
        when(listingProviderClient.search(anyString(), any())).thenAnswer(invocation -> {
            String location = invocation.getArgument(0);
            if ("Paris".equals(location)) {
                release.await(5, TimeUnit.SECONDS);
            }
            return List.of(listing(location, 100));
        });

        long start = System.nanoTime();
        SearchResponse response;
        try {
            response = searchAggregator.aggregate("homes anywhere");
        } finally {
            release.countDown();
        }

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(3000);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getProperties()).extracting(Property::getId)
            .hasSize(4)
            .doesNotContain("Paris");
    }

    @Test
    void shouldCapResultsUnderConcurrentFanOut() {
        searchProperties.setMaxResults(3);
        when(listingProviderClient.search(anyString(), any())).thenAnswer(invocation -> {
            String location = invocation.getArgument(0);
            List<RawListing> listings = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                listings.add(listing(location + "-" + i, i * 10));
            }
            return listings;
        });

        SearchResponse response = searchAggregator.aggregate("villas in europe and asia");

        assertThat(response.getLocations()).hasSize(10);
        assertThat(response.getProperties()).hasSize(3);
        assertThat(response.getTotal()).isEqualTo(3);
    }

    @Test
    void shouldReportUnresolvedLocations() {
        when(listingProviderClient.search(eq("Lake Tahoe"), any())).thenAnswer(invocation -> List.of());

        SearchResponse response = searchAggregator.aggregate("cabin near Lake Tahoe");

        assertThat(response.getUnresolvedLocations()).containsExactly("Lake Tahoe");
    }

    @Test
    void shouldMentionDegradedProvider() {
        assertThatThrownBy(() -> circuitBreaker.execute(() -> {
            throw new IOException("down");
        })).isInstanceOf(IOException.class);
        when(listingProviderClient.search(eq("Miami"), any())).thenAnswer(invocation -> List.of());

        SearchResponse response = searchAggregator.aggregate("condo in Miami");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getMessage()).contains("degraded");
    }

    @Test
    void shouldBoundSingleLocationSearchByDeadline() {
        searchProperties.setRequestTimeoutMs(200);
        CountDownLatch release = new CountDownLatch(1);
        when(listingProviderClient.search(eq("Miami"), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of(listing("late", 100));
        });

        long start = System.nanoTime();
        SearchResponse response;
        try {
            response = searchAggregator.aggregate("homes in Miami");
        } finally {
            release.countDown();
        }

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2000);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getProperties()).isEmpty();
        assertThat(response.getMessage()).startsWith("No properties found in Miami");
    }

    @Test
    void shouldNotTripBreakerWhenDeadlineCancelsSlowProvider() throws Exception {
        ExecutorService serverExecutor = Executors.newCachedThreadPool();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(serverExecutor);
        server.createContext("/api/v2/searchPropertyByPlaceId", exchange -> {
            try {
                Thread.sleep(5000);
                byte[] body = "{\"data\": []}".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(200, body.length);
                exchange.getResponseBody().write(body);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                exchange.close();
            }
        });
        server.start();
        try {
            RapidApiProperties rapidApiProperties = new RapidApiProperties();
            rapidApiProperties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
            rapidApiProperties.setApiKey("test-key");
            ResilienceProperties resilienceProperties = new ResilienceProperties();
            resilienceProperties.setBaseDelayMs(10);
            resilienceProperties.setMaxDelayMs(10);
            CircuitBreaker breaker = new CircuitBreaker("slow", 5, Duration.ofSeconds(60));
            GeoResolver geoResolver = new GeoResolver();
            ListingProviderClientImpl providerClient = new ListingProviderClientImpl(
                new RapidApiClient(rapidApiProperties),
                rapidApiProperties,
                geoResolver,
                breaker,
                new RetryExecutor(),
                resilienceProperties,
                new ObjectMapper());
            searchProperties.setRequestTimeoutMs(300);
            SearchAggregatorImpl aggregator = new SearchAggregatorImpl(
                new QuerySanitizer(),
                new IntentExtractor(new IntentProperties()),
                geoResolver,
                providerClient,
                new ResultNormalizer(searchProperties),
                breaker,
                searchProperties);

            SearchResponse response = aggregator.aggregate("homes globally");
            // let the cancelled workers unwind
            Thread.sleep(500);

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getLocations()).hasSize(5);
            assertThat(response.getProperties()).isEmpty();
            assertThat(breaker.getFailureCount()).isZero();
            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        } finally {
            server.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    private static RawListing listing(String id, int price) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("id", id);
        fields.put("name", "Stay " + id);
        fields.put("price", price);
        return RawListing.of(fields);
    }

}
