package com.starscape.photolog.features.metadata.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoDistanceTest {

    private static final double SEOUL_LAT = 37.5665;
    private static final double SEOUL_LON = 126.9780;

    @Test
    void haversineMatchesKnownDistances() {
        double seoulBusan = GeoDistance.haversineKm(SEOUL_LAT, SEOUL_LON, 35.1796, 129.0756);
        double seoulIncheon = GeoDistance.haversineKm(SEOUL_LAT, SEOUL_LON, 37.4563, 126.7052);

        assertEquals(325, seoulBusan, 5);
        assertEquals(27, seoulIncheon, 3);
        assertEquals(0, GeoDistance.haversineKm(SEOUL_LAT, SEOUL_LON, SEOUL_LAT, SEOUL_LON), 1e-9);
    }

    @Test
    void longitudeBoxWidensAwayFromTheEquator() {
        double equator = GeoDistance.longitudeDelta(0, 100);
        double north = GeoDistance.longitudeDelta(60, 100);

        assertTrue(north > equator);
        assertEquals(GeoDistance.latitudeDelta(100), equator, 0.01);
        assertEquals(180.0, GeoDistance.longitudeDelta(89.9, 500));
    }

    @Test
    void longitudeBoxIsUnboundedWhenTheCircleReachesAPole() {
        double lonDelta = GeoDistance.longitudeDelta(89.9, 20);
        double distance = GeoDistance.haversineKm(89.9, 0, 89.95, 90);

        assertEquals(180.0, lonDelta);
        assertTrue(distance < 20);
        assertEquals(180.0, GeoDistance.longitudeDelta(-89.9, 20));
        assertTrue(GeoDistance.longitudeDelta(80, 20) < 180.0);
    }

    @Test
    void nonFiniteCoordinatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> GeoDistance.validateCoordinates(Double.NaN, 0));
        assertThrows(IllegalArgumentException.class, () -> GeoDistance.validateCoordinates(0, Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> GeoDistance.validateCoordinates(0, Double.POSITIVE_INFINITY));
    }

    @Test
    void coordinatesOutOfRangeAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> GeoDistance.validateCoordinates(90.5, 0));
        assertThrows(IllegalArgumentException.class, () -> GeoDistance.validateCoordinates(0, -181));
        GeoDistance.validateCoordinates(-90, 180);
    }
}
