package org.greenroute.routing.geo;

import lombok.experimental.UtilityClass;

/**
 * Great-circle distance helpers used for matrix construction.
 */
@UtilityClass
public final class GeoMetric {
    public static final double EARTH_RADIUS_KM = 6_371.0d;

    public static final double MIN_LAT = -90.0d;
    public static final double MAX_LAT = 90.0d;
    public static final double MIN_LON = -180.0d;
    public static final double MAX_LON = 180.0d;

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     *
     * @param a first coordinate.
     * @param b second coordinate.
     * @return distance in kilometers, {@code 0} for identical coordinates.
     */
    public static double distance(Location a, Location b) {
        return distanceKm(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    /**
     * Computes great-circle distance in kilometers from raw degree values.
     */
    public static double distanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Returns whether both components are finite and inside WGS84 degree bounds.
     */
    public static boolean isValid(Location location) {
        if (location == null) {
            return false;
        }
        double lat = location.getLatitude();
        double lon = location.getLongitude();
        return Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= MIN_LAT && lat <= MAX_LAT
                && lon >= MIN_LON && lon <= MAX_LON;
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
