package fun.fengwk.stay.core.facade.listing.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * Untrusted listing record as returned by the provider.
 *
 * <p>Values of {@link #fields} are maps, lists, strings, numbers, booleans or null, in any
 * combination the provider chooses to send.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class RawListing {

    /**
     * Provider document.
     */
    private Map<String, Object> fields;

    /**
     * Location the listing was searched for, set by the aggregator.
     */
    private String sourceLocation;

    public static RawListing of(Map<String, Object> fields) {
        return new RawListing(fields, null);
    }

}
