package fun.fengwk.stay.core.service.enhance.model;

import java.util.List;

/**
 * Model-written summary of a result set.
 *
 * @author fengwk
 */
public record EnhancedSummary(String summary, List<String> matchReasons) {
}
