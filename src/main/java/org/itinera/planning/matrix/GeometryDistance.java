package org.itinera.planning.matrix;

import lombok.experimental.UtilityClass;
import org.itinera.planning.model.GeoPoint;

/**
 * Numeric helpers for straight-line travel estimation.
 */
@UtilityClass
class GeometryDistance {
    private static final double EARTH_RADIUS_KM = 6_371.0d;

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     */
    static double greatCircleDistanceKm(GeoPoint from, GeoPoint to) {
        return greatCircleDistanceKm(from.getLat(), from.getLng(), to.getLat(), to.getLng());
    }

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     */
    static double greatCircleDistanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.atan2(Math.sqrt(clampedA), Math.sqrt(1.0d - clampedA));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Whole minutes needed to cover {@code distanceKm} at {@code speedKmh}, rounded up.
     */
    static int travelMinutes(double distanceKm, double speedKmh) {
        return (int) Math.ceil(distanceKm / speedKmh * 60.0d);
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
