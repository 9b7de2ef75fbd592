package com.starscape.photolog.features.metadata.domain;

/**
 * Great-circle helpers on a spherical earth.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double KM_PER_DEGREE_LATITUDE = 111.0;

    private GeoDistance() {
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    /**
     * Half-height in degrees of a box that contains every point within {@code radiusKm}.
     */
    public static double latitudeDelta(double radiusKm) {
        return radiusKm / KM_PER_DEGREE_LATITUDE;
    }

    /**
     * Half-width in degrees of a box that contains every point within {@code radiusKm}
     * of a point at {@code latitude}. Widens towards the poles; 180 means no longitude bound.
     */
    public static double longitudeDelta(double latitude, double radiusKm) {
        double farthestLatitude = Math.abs(latitude) + latitudeDelta(radiusKm);
        // The circle reaches a pole, so every meridian passes through it
        if (farthestLatitude >= 90.0) {
            return 180.0;
        }
        double cos = Math.cos(Math.toRadians(farthestLatitude));
        return Math.min(180.0, radiusKm / (KM_PER_DEGREE_LATITUDE * cos));
    }

    /**
     * @throws IllegalArgumentException if either value is out of range, infinite or NaN
     */
    public static void validateCoordinates(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180: " + longitude);
        }
    }
}
