package fun.fengwk.stay.core.service.geo;

import fun.fengwk.stay.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps location names to provider area ids (place ids).
 *
 * <p>Lookup order: exact match, substring match in either direction (first table entry wins),
 * abbreviation, then the default area.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class GeoResolver {

    /**
     * Area id used when nothing matches (San Francisco).
     */
    public static final String DEFAULT_AREA_ID = "ChIJIQBpAG2ahYAR_6128GcTUEo";

    /**
     * Shorter inputs only match table entries that they fully contain.
     */
    private static final int MIN_PARTIAL_INPUT_LENGTH = 3;

    private static final Map<String, String> AREA_IDS;
    private static final Map<String, String> ABBREVIATIONS;

    static {
        // Insertion order is the substring-match priority.
        Map<String, String> areas = new LinkedHashMap<>();
        areas.put("san francisco", DEFAULT_AREA_ID);
        areas.put("new york", "ChIJOwg_06VPwokRYv534QaPC8g");
        areas.put("los angeles", "ChIJE9on3F3HwoAR9AhGJW_fL-I");
        areas.put("miami", "ChIJEcHIDqKw2YgRZU-t3XHylv8");
        areas.put("chicago", "ChIJ7cv00DwsDogRAMDACa2m4K8");
        areas.put("boston", "ChIJGzE9DS1l44kRoOhiASS_fHg");
        areas.put("seattle", "ChIJVTPokywQkFQRmtVEaUZlJRA");
        areas.put("las vegas", "ChIJ0X31pIK3voARo3mz1ebVzDo");
        areas.put("washington", "ChIJW-T2Wt7Gt4kRKl2I1CJFUsI");
        areas.put("new orleans", "ChIJZYIRslSkIIYRA0flgTL3Vck");
        areas.put("austin", "ChIJLwPMoJm1RIYRetVp1EtGm10");
        areas.put("san diego", "ChIJSx6SrQ9T2YARed8V_f0hOg0");
        areas.put("toronto", "ChIJpTvG15DL1IkRd8S0KlBVNTI");
        areas.put("vancouver", "ChIJs0-pQ_FzhlQRi_OBm-qWkbs");
        areas.put("mexico city", "ChIJB3UJ2yYAzoURQeheJnYQBlQ");
        areas.put("london", "ChIJdd4hrwug2EcRmSrV3Vo6llI");
        areas.put("paris", "ChIJD7fiBh9u5kcRYJSMaMOCCwQ");
        areas.put("barcelona", "ChIJ5TCOcRaYpBIRCmZHTz37sEQ");
        areas.put("rome", "ChIJu46S-ZZhLxMROG5lkwZ3D7k");
        areas.put("amsterdam", "ChIJVXealLU_xkcRja_At0z9AGY");
        areas.put("berlin", "ChIJAVkDPzdOqEcRcDteW0YgIQQ");
        areas.put("lisbon", "ChIJO_PkYRozGQ0R0DaQ5L3rAAQ");
        areas.put("tokyo", "ChIJ51cu8IcbXWARiRtXIothAS4");
        areas.put("bangkok", "ChIJ82ENKDJgHTERIEjiXbIAAQE");
        areas.put("singapore", "ChIJdZOLiiMR2jERxPWrUs9peIg");
        areas.put("seoul", "ChIJzWXFYYuifDUR64Pq5LTtioU");
        areas.put("bali", "ChIJoQ8Q6NNB0S0RkOYkS7EPkSQ");
        areas.put("dubai", "ChIJRcbZaklDXz4RYlEphFBu5r0");
        areas.put("sydney", "ChIJP3Sa8ziYEmsRUKgyFmh9AQM");
        areas.put("melbourne", "ChIJ90260rVG1moRkM2MIXVWBAQ");
        areas.put("auckland", "ChIJ--acWvtHDW0RF5miQ2HvAAU");
        areas.put("brisbane", "ChIJM9KTrJpXkWsRQK_e81qjAgQ");
        areas.put("perth", "ChIJc9U7KdW6MioR4E7fNbXwBAU");
        areas.put("rio de janeiro", "ChIJW6AIkVXemwARTtIvZ2xC3FA");
        areas.put("buenos aires", "ChIJvQz5TjvKvJURh47oiC6Bs6A");
        areas.put("lima", "ChIJ9-CE8K7IBZERZTU4WOwbcw4");
        areas.put("bogota", "ChIJKcumLf2bP44RFDmjIFVjnSM");
        areas.put("santiago", "ChIJL68lBEHFYpYRHWd2fhCgO5M");
        AREA_IDS = Collections.unmodifiableMap(areas);

        Map<String, String> abbreviations = new LinkedHashMap<>();
        abbreviations.put("nyc", "new york");
        abbreviations.put("ny", "new york");
        abbreviations.put("la", "los angeles");
        abbreviations.put("sf", "san francisco");
        abbreviations.put("dc", "washington");
        abbreviations.put("vegas", "las vegas");
        abbreviations.put("nola", "new orleans");
        abbreviations.put("rio", "rio de janeiro");
        abbreviations.put("bcn", "barcelona");
        ABBREVIATIONS = Collections.unmodifiableMap(abbreviations);
    }

    public GeoResolution resolve(String locationName) {
        String key = normalize(locationName);
        if (key.isEmpty()) {
            log.warn("blank location, using default area, areaId={}", DEFAULT_AREA_ID);
            return new GeoResolution(DEFAULT_AREA_ID, null, true);
        }

        Optional<GeoResolution> resolution = lookup(key);
        if (resolution.isPresent()) {
            return resolution.get();
        }

        log.warn("unknown location, using default area, location={}, areaId={}", locationName, DEFAULT_AREA_ID);
        return new GeoResolution(DEFAULT_AREA_ID, null, true);
    }

    /**
     * Whether {@link #resolve(String)} would find a mapping, without logging.
     */
    public boolean isKnown(String locationName) {
        String key = normalize(locationName);
        return !key.isEmpty() && lookup(key).isPresent();
    }

    private Optional<GeoResolution> lookup(String key) {
        String areaId = AREA_IDS.get(key);
        if (areaId != null) {
            return Optional.of(new GeoResolution(areaId, key, false));
        }

        for (Map.Entry<String, String> entry : AREA_IDS.entrySet()) {
            String name = entry.getKey();
            boolean inputContainsName = key.contains(name);
            boolean nameContainsInput = key.length() >= MIN_PARTIAL_INPUT_LENGTH && name.contains(key);
            if (inputContainsName || nameContainsInput) {
                return Optional.of(new GeoResolution(entry.getValue(), name, false));
            }
        }

        String expanded = ABBREVIATIONS.get(key);
        if (expanded != null) {
            return Optional.of(new GeoResolution(AREA_IDS.get(expanded), expanded, false));
        }
        return Optional.empty();
    }

    public List<SupportedLocation> supportedLocations() {
        List<SupportedLocation> locations = new ArrayList<>(AREA_IDS.size());
        for (Map.Entry<String, String> entry : AREA_IDS.entrySet()) {
            locations.add(new SupportedLocation(TextUtils.titleCase(entry.getKey()), entry.getValue()));
        }
        return locations;
    }

    private static String normalize(String locationName) {
        if (StringUtils.isBlank(locationName)) {
            return "";
        }
        return StringUtils.normalizeSpace(locationName).toLowerCase(Locale.ROOT);
    }

}
