package com.example.presence.shared.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoUtilsTest {

    @Test
    void distanceBetweenKnownPointsShouldMatchGreatCircle() {
        // London to Paris
        double meters = GeoUtils.haversineMeters(51.5072, -0.1276, 48.8566, 2.3522);

        assertThat(meters).isCloseTo(343_500d, within(1_500d));
    }

    @Test
    void samePointShouldBeZeroAndDistanceSymmetric() {
        assertThat(GeoUtils.haversineMeters(51.5, -0.12, 51.5, -0.12)).isZero();
        assertThat(GeoUtils.haversineMeters(51.5, -0.12, 51.51, -0.13))
                .isCloseTo(GeoUtils.haversineMeters(51.51, -0.13, 51.5, -0.12), within(1e-6));
    }

    @Test
    void coordinateValidationShouldRejectMissingAndOutOfRange() {
        assertThat(GeoUtils.isValidCoordinate(51.5, -0.12)).isTrue();
        assertThat(GeoUtils.isValidCoordinate(-90d, 180d)).isTrue();

        assertThat(GeoUtils.isValidCoordinate(null, 0d)).isFalse();
        assertThat(GeoUtils.isValidCoordinate(0d, null)).isFalse();
        assertThat(GeoUtils.isValidCoordinate(90.0001, 0d)).isFalse();
        assertThat(GeoUtils.isValidCoordinate(0d, -180.5)).isFalse();
        assertThat(GeoUtils.isValidCoordinate(Double.NaN, 0d)).isFalse();
    }
}
