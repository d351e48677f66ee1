package fun.fengwk.stay.core.facade.listing.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.stay.core.facade.listing.model.ListingSearchFilters;
import fun.fengwk.stay.core.facade.listing.model.RawListing;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiClient;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiClientResponse;
import fun.fengwk.stay.core.facade.listing.rapidapi.RapidApiProperties;
import fun.fengwk.stay.core.service.geo.GeoResolver;
import fun.fengwk.stay.core.service.resilience.CircuitBreaker;
import fun.fengwk.stay.core.service.resilience.CircuitState;
import fun.fengwk.stay.core.service.resilience.ResilienceProperties;
import fun.fengwk.stay.core.service.resilience.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ListingProviderClientImpl tests.
 *
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class ListingProviderClientImplTest {

    private static final String MIAMI = "ChIJEcHIDqKw2YgRZU-t3XHylv8";

    @Mock
    private RapidApiClient rapidApiClient;

    private CircuitBreaker circuitBreaker;
    private ListingProviderClientImpl listingProviderClient;

    @BeforeEach
    void setUp() {
        ResilienceProperties resilienceProperties = new ResilienceProperties();
        resilienceProperties.setBaseDelayMs(0);
        resilienceProperties.setMaxDelayMs(0);
        circuitBreaker = new CircuitBreaker("test", 5, Duration.ofSeconds(60));
        listingProviderClient = new ListingProviderClientImpl(
            rapidApiClient,
            new RapidApiProperties(),
            new GeoResolver(),
            circuitBreaker,
            new RetryExecutor(),
            resilienceProperties,
            new ObjectMapper());
    }

    @Test
    void shouldParseDataArrayAndSendFilters() throws Exception {
        when(rapidApiClient.search(anyMap())).thenReturn(ok("""
            {"status": true, "data": [
              {"listing": {"id": "1", "name": "Loft"}},
              {"listing": {"id": "2"}},
              "not an object"
            ]}"""));

        ListingSearchFilters filters = ListingSearchFilters.builder()
            .adults(4)
            .checkin(LocalDate.of(2024, 7, 1))
            .checkout(LocalDate.of(2024, 7, 5))
            .priceMax(300)
            .build();
        List<RawListing> listings = listingProviderClient.search("Miami", filters);

        assertThat(listings).hasSize(2);
        assertThat(listings.get(0).getFields()).containsKey("listing");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> paramsCaptor = ArgumentCaptor.forClass(Map.class);
        verify(rapidApiClient).search(paramsCaptor.capture());
        assertThat(paramsCaptor.getValue())
            .containsEntry("placeId", MIAMI)
            .containsEntry("adults", "4")
            .containsEntry("children", "0")
            .containsEntry("currency", "USD")
            .containsEntry("checkin", "2024-07-01")
            .containsEntry("checkout", "2024-07-05")
            .containsEntry("priceMax", "300")
            .doesNotContainKey("priceMin");
    }

    @Test
    void shouldParseNestedDataList() throws Exception {
        when(rapidApiClient.search(anyMap())).thenReturn(ok("""
            {"data": {"list": [{"id": 7}]}}"""));

        List<RawListing> listings = listingProviderClient.search("Paris", null);

        assertThat(listings).hasSize(1);
        assertThat(listings.get(0).getFields()).containsEntry("id", 7);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"status\": false, \"message\": \"quota exceeded\", \"data\": []}",
        "{\"data\": {\"items\": []}}",
        "[1, 2, 3]",
        "{\"results\": []}",
        "not json",
        ""
    })
    void shouldReturnEmptyForUnexpectedShapes(String body) throws Exception {
        when(rapidApiClient.search(anyMap())).thenReturn(ok(body));

        assertThat(listingProviderClient.search("Miami", null)).isEmpty();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "12345", "$$$"})
    void shouldSkipInvalidLocationsWithoutCallingProvider(String location) throws Exception {
        assertThat(listingProviderClient.search(location, null)).isEmpty();
        verify(rapidApiClient, never()).search(anyMap());
    }

    @Test
    void shouldSkipOverlongLocation() throws Exception {
        assertThat(listingProviderClient.search("a".repeat(101), null)).isEmpty();
        verify(rapidApiClient, never()).search(anyMap());
    }

    @Test
    void shouldRetryRateLimitAndSucceed() throws Exception {
        when(rapidApiClient.search(anyMap()))
            .thenReturn(status(429))
            .thenReturn(ok("{\"data\": [{\"id\": \"1\"}]}"));

        List<RawListing> listings = listingProviderClient.search("Miami", null);

        assertThat(listings).hasSize(1);
        verify(rapidApiClient, times(2)).search(anyMap());
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyAfterExhaustingRetries() throws Exception {
        when(rapidApiClient.search(anyMap())).thenReturn(status(503));

        assertThat(listingProviderClient.search("Miami", null)).isEmpty();
        verify(rapidApiClient, times(3)).search(anyMap());
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(3);
    }

    @Test
    void shouldCountTransportFailuresTowardsBreaker() throws Exception {
        when(rapidApiClient.search(anyMap())).thenReturn(RapidApiClientResponse.builder()
            .error(new IOException("connection refused"))
            .build());

        assertThat(listingProviderClient.search("Miami", null)).isEmpty();
        assertThat(listingProviderClient.search("Paris", null)).isEmpty();

        // 5 failures open the breaker, the sixth attempt is rejected without a call
        verify(rapidApiClient, times(5)).search(anyMap());
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void shouldNotCountCancelledRequestTowardsBreaker() throws Exception {
        when(rapidApiClient.search(anyMap())).thenThrow(new InterruptedException("cancelled"));

        try {
            assertThat(listingProviderClient.search("Miami", null)).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        verify(rapidApiClient, times(1)).search(anyMap());
        assertThat(circuitBreaker.getFailureCount()).isZero();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    private static RapidApiClientResponse ok(String body) {
        return RapidApiClientResponse.builder().statusCode(200).body(body).build();
    }

    private static RapidApiClientResponse status(int statusCode) {
        return RapidApiClientResponse.builder().statusCode(statusCode).body("{}").build();
    }

}
