package fun.fengwk.stay.core.service.enhance;

import fun.fengwk.stay.core.service.enhance.model.EnhancedSummary;
import fun.fengwk.stay.core.service.search.model.Property;

import java.util.List;
import java.util.Optional;

/**
 * Optional language-model helper, every method degrades instead of failing.
 *
 * @author fengwk
 */
public interface ResultEnhancer {

    boolean isAvailable();

    /**
     * Summarize why the properties fit the query.
     *
     * @return empty when unavailable, timed out or the answer could not be used
     */
    Optional<EnhancedSummary> summarize(String query, List<Property> properties);

    /**
     * Complete a partial query into full search suggestions, never empty.
     */
    List<String> suggest(String partialQuery);

}
