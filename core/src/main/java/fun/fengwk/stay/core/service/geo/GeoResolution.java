package fun.fengwk.stay.core.service.geo;

/**
 * Result of mapping a location name to a provider area id.
 *
 * @param areaId      provider area id, never null
 * @param matchedName table entry that matched, null when the default area was used
 * @param fallback    true when no table entry matched and the default area was used
 * @author fengwk
 */
public record GeoResolution(String areaId, String matchedName, boolean fallback) {
}
