package fun.fengwk.stay.core.mcp;

import fun.fengwk.stay.core.service.StaySearchService;
import fun.fengwk.stay.core.service.geo.SupportedLocation;
import fun.fengwk.stay.core.service.model.HealthStatus;
import fun.fengwk.stay.core.service.search.model.SearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
public class StaySearchMcpTest {

    @Mock
    private StaySearchService staySearchService;

    @Mock
    private McpFormatter mcpFormatter;

    private StaySearchMcp staySearchMcp;

    @BeforeEach
    void setUp() {
        staySearchMcp = new StaySearchMcp(staySearchService, mcpFormatter);
    }

    @Test
    public void testStaySearch() {
        SearchResponse response = SearchResponse.builder().success(true).build();
        when(staySearchService.search("villa in Rome", "2024-07-01", null)).thenReturn(response);
        when(mcpFormatter.format("stay_search_result.ftl", response)).thenReturn("ok");

        String result = staySearchMcp.search("villa in Rome", "2024-07-01", null);
        log.info("stay_search result:\n{}", result);

        assertThat(result).isEqualTo("ok");
        verify(mcpFormatter).format("stay_search_result.ftl", response);
    }

    @Test
    public void testStaySearchFormatError() {
        SearchResponse response = SearchResponse.builder().success(false).error("query is blank").build();
        when(staySearchService.search(" ", null, null)).thenReturn(response);
        when(mcpFormatter.format("stay_search_result.ftl", response)).thenReturn("format error: boom");

        assertThat(staySearchMcp.search(" ", null, null)).isEqualTo("format error: boom");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testStayLocations() {
        List<SupportedLocation> locations = List.of(new SupportedLocation("Miami", "id-1"));
        when(staySearchService.supportedLocations()).thenReturn(locations);
        when(mcpFormatter.format(eq("stay_locations_result.ftl"), any())).thenReturn("ok");

        assertThat(staySearchMcp.locations()).isEqualTo("ok");

        ArgumentCaptor<Object> modelCaptor = ArgumentCaptor.forClass(Object.class);
        verify(mcpFormatter).format(eq("stay_locations_result.ftl"), modelCaptor.capture());
        assertThat((Map<String, Object>) modelCaptor.getValue()).containsEntry("locations", locations);
    }

    @Test
    public void testStayHealth() {
        HealthStatus health = HealthStatus.builder().status("healthy").build();
        when(staySearchService.health()).thenReturn(health);
        when(mcpFormatter.format("stay_health_result.ftl", health)).thenReturn("status: healthy");

        assertThat(staySearchMcp.health()).isEqualTo("status: healthy");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testStaySuggestions() {
        when(staySearchService.suggestions(null)).thenReturn(List.of("Beach house in Miami"));
        when(mcpFormatter.format(eq("stay_suggestions_result.ftl"), any())).thenReturn("1. Beach house in Miami");

        assertThat(staySearchMcp.suggestions(null)).isEqualTo("1. Beach house in Miami");

        ArgumentCaptor<Object> modelCaptor = ArgumentCaptor.forClass(Object.class);
        verify(mcpFormatter).format(eq("stay_suggestions_result.ftl"), modelCaptor.capture());
        assertThat((Map<String, Object>) modelCaptor.getValue())
            .containsEntry("query", "")
            .containsEntry("suggestions", List.of("Beach house in Miami"));
    }

}
