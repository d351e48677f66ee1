package fun.fengwk.stay.core.service.intent;

import java.util.Optional;

/**
 * A single location extraction rule applied to the lower-cased query.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface LocationRule {

    Optional<String> extract(String lowerCaseQuery);

}
