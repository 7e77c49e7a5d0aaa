package com.chronoline.timeline.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GeoPointTest {

    @Test
    void acceptsBoundaryCoordinates() {
        assertThatCode(() -> new GeoPoint(-90, -180)).doesNotThrowAnyException();
        assertThatCode(() -> new GeoPoint(90, 180)).doesNotThrowAnyException();
    }

    @Test
    void rejectsLatitudeOutOfRange() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new GeoPoint(90.5, 0))
                .withMessageContaining("latitude");
    }

    @Test
    void rejectsLongitudeOutOfRange() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new GeoPoint(0, -180.01))
                .withMessageContaining("longitude");
    }

    @Test
    void geoJsonUsesLongitudeFirst() {
        GeoPoint paris = new GeoPoint(48.8566, 2.3522);
        assertThat(paris.toGeoJson())
                .isEqualTo("{\"type\":\"Point\",\"coordinates\":[2.3522,48.8566]}");
    }
}
