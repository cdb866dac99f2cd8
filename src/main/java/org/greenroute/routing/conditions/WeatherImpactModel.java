package org.greenroute.routing.conditions;

import lombok.experimental.UtilityClass;

/**
 * Converts observed weather into a travel-time multiplier.
 *
 * <p>Rain adds a flat 10% plus 2% per millimeter, wind above 20 km/h adds 1% per km/h,
 * visibility below 5 km adds 10% per missing kilometer. The result is capped at
 * {@link #MAX_MULTIPLIER}.</p>
 */
@UtilityClass
public final class WeatherImpactModel {
    public static final double MAX_MULTIPLIER = 2.0d;

    private static final double RAIN_BASE_PENALTY = 0.1d;
    private static final double RAIN_PENALTY_PER_10_MM = 0.2d;
    private static final double WIND_THRESHOLD_KMH = 20.0d;
    private static final double VISIBILITY_THRESHOLD_KM = 5.0d;

    /**
     * Computes the capped impact multiplier, {@code 1.0} when no conditions are known.
     */
    public static double impactMultiplier(WeatherConditions conditions) {
        if (conditions == null) {
            return 1.0d;
        }
        double multiplier = 1.0d;

        double precipitation = conditions.getPrecipitationMm();
        if (precipitation > 0.0d) {
            multiplier += RAIN_BASE_PENALTY + (precipitation / 10.0d) * RAIN_PENALTY_PER_10_MM;
        }

        double wind = conditions.getWindSpeedKmh();
        if (wind > WIND_THRESHOLD_KMH) {
            multiplier += (wind - WIND_THRESHOLD_KMH) / 100.0d;
        }

        double visibility = conditions.getVisibilityKm();
        if (visibility < VISIBILITY_THRESHOLD_KM) {
            multiplier += (VISIBILITY_THRESHOLD_KM - visibility) / 10.0d;
        }

        return Math.min(multiplier, MAX_MULTIPLIER);
    }
}
