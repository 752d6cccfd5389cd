package org.mides.delivery.util;

import org.mides.delivery.model.Coordinate;

public class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /* Rough length of one degree of latitude */
    public static final double KM_PER_DEGREE = 111.0;

    private GeoUtils() {
    }

    public static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    /* Ignores the longitude shrink away from the equator */
    public static double degreeDistanceKm(Coordinate from, Coordinate to) {
        double dLat = to.getLatitude() - from.getLatitude();
        double dLng = to.getLongitude() - from.getLongitude();
        return Math.sqrt(dLat * dLat + dLng * dLng) * KM_PER_DEGREE;
    }
}
