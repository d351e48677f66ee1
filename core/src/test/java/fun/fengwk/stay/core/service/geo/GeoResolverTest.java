package fun.fengwk.stay.core.service.geo;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * GeoResolver tests.
 *
 * @author fengwk
 */
class GeoResolverTest {

    private static final String MIAMI = "ChIJEcHIDqKw2YgRZU-t3XHylv8";
    private static final String NEW_YORK = "ChIJOwg_06VPwokRYv534QaPC8g";
    private static final String LOS_ANGELES = "ChIJE9on3F3HwoAR9AhGJW_fL-I";

    private final GeoResolver geoResolver = new GeoResolver();

    @Test
    void shouldResolveExactMatchIgnoringCase() {
        GeoResolution resolution = geoResolver.resolve("  MIAMI ");

        assertThat(resolution.areaId()).isEqualTo(MIAMI);
        assertThat(resolution.matchedName()).isEqualTo("miami");
        assertThat(resolution.fallback()).isFalse();
    }

    @Test
    void shouldResolveWhenInputContainsKnownName() {
        assertThat(geoResolver.resolve("Downtown Miami Beach").areaId()).isEqualTo(MIAMI);
    }

    @Test
    void shouldResolveWhenKnownNameContainsInput() {
        assertThat(geoResolver.resolve("york").areaId()).isEqualTo(NEW_YORK);
    }

    @Test
    void shouldResolveAbbreviations() {
        assertThat(geoResolver.resolve("NYC").areaId()).isEqualTo(NEW_YORK);
        assertThat(geoResolver.resolve("la").areaId()).isEqualTo(LOS_ANGELES);
    }

    @Test
    void shouldFallBackToDefaultArea() {
        GeoResolution resolution = geoResolver.resolve("Atlantis");

        assertThat(resolution.areaId()).isEqualTo(GeoResolver.DEFAULT_AREA_ID);
        assertThat(resolution.fallback()).isTrue();
        assertThat(geoResolver.isKnown("Atlantis")).isFalse();
    }

    @Test
    void shouldFallBackForBlankInput() {
        assertThat(geoResolver.resolve(null).fallback()).isTrue();
        assertThat(geoResolver.resolve(" ").areaId()).isEqualTo(GeoResolver.DEFAULT_AREA_ID);
        assertThat(geoResolver.isKnown(null)).isFalse();
    }

    @Test
    void shouldListSupportedLocationsInTableOrder() {
        assertThat(geoResolver.supportedLocations())
            .isNotEmpty()
            .first()
            .satisfies(location -> {
                assertThat(location.getName()).isEqualTo("San Francisco");
                assertThat(location.getAreaId()).isEqualTo(GeoResolver.DEFAULT_AREA_ID);
            });
        assertThat(geoResolver.supportedLocations())
            .extracting(SupportedLocation::getName)
            .contains("New York", "Miami", "Tokyo");
    }

}
