package fun.fengwk.stay.core.service.geo;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Location known to the geo table.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class SupportedLocation {

    /**
     * Display name.
     */
    private String name;

    /**
     * Provider area id.
     */
    private String areaId;

}
