package fun.fengwk.stay.core.mcp;

import fun.fengwk.stay.core.service.StaySearchService;
import fun.fengwk.stay.core.service.geo.SupportedLocation;
import fun.fengwk.stay.core.service.model.HealthStatus;
import fun.fengwk.stay.core.service.search.model.SearchResponse;
import fun.fengwk.stay.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class StaySearchMcp {

    private final StaySearchService staySearchService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "stay_search",
        description = """
            Search vacation rentals with a natural-language query and return the best matches.
            The query may name one or more places, a region (europe, asia, ...) or ask to search globally, \
            and may include price limits, bedrooms, guests, property type and sort words like cheapest or luxury.
            Return format: summary line, resolved criteria and a property list with price, rating, guests and link; \
            or a message that nothing was found; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String search(
        @ToolParam(description = """
            Natural-language query, e.g.
            - cheap apartment in Miami for 4 guests under $200
            - luxury villas in europe
            - cheapest large homes globally""") String query,
        @ToolParam(description = "check-in date, yyyy-MM-dd, default flexible", required = false) String checkin,
        @ToolParam(description = "check-out date, yyyy-MM-dd, default flexible", required = false) String checkout
    ) {
        SearchResponse response = staySearchService.search(query, checkin, checkout);
        return mcpFormatter.format("stay_search_result.ftl", response);
    }

    @Tool(name = "stay_locations",
        description = """
            List the locations with a known search area.
            No parameters.
            Other locations are still accepted but are searched in the default area.""",
        resultConverter = StringToolCallResultConverter.class)
    public String locations() {
        List<SupportedLocation> locations = staySearchService.supportedLocations();
        return mcpFormatter.format("stay_locations_result.ftl", Map.of("locations", locations));
    }

    @Tool(name = "stay_health",
        description = """
            Report the health of the search service: listings provider circuit state and AI enhancer availability.
            No parameters.""",
        resultConverter = StringToolCallResultConverter.class)
    public String health() {
        HealthStatus health = staySearchService.health();
        return mcpFormatter.format("stay_health_result.ftl", health);
    }

    @Tool(name = "stay_suggestions",
        description = """
            Suggest complete search queries for a partial query.
            Return format: numbered suggestion list.""",
        resultConverter = StringToolCallResultConverter.class)
    public String suggestions(
        @ToolParam(description = "partial query typed so far, e.g. beach") String partialQuery
    ) {
        List<String> suggestions = staySearchService.suggestions(partialQuery);
        return mcpFormatter.format("stay_suggestions_result.ftl", Map.of(
            "query", partialQuery == null ? "" : partialQuery,
            "suggestions", suggestions
        ));
    }

}
