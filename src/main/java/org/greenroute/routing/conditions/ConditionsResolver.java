package org.greenroute.routing.conditions;

import org.greenroute.routing.geo.Location;
import org.greenroute.routing.model.Preferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Consults traffic and weather collaborators and turns their output into defaulted scalars.
 *
 * <p>Collaborator failures never escape this class: a thrown exception, a non-finite value
 * or a non-positive value is replaced with {@code 1.0} and reported as degraded. Weather
 * values are capped at {@link WeatherImpactModel#MAX_MULTIPLIER}.</p>
 */
public final class ConditionsResolver {
    private static final Logger log = LoggerFactory.getLogger(ConditionsResolver.class);

    static final double DEFAULT_MULTIPLIER = 1.0d;

    private final TrafficProvider trafficProvider;
    private final WeatherProvider weatherProvider;

    /**
     * @param trafficProvider optional traffic source; {@code null} means always neutral.
     * @param weatherProvider optional weather source; {@code null} means always neutral.
     */
    public ConditionsResolver(TrafficProvider trafficProvider, WeatherProvider weatherProvider) {
        this.trafficProvider = trafficProvider;
        this.weatherProvider = weatherProvider;
    }

    /**
     * Resolves both multipliers for one optimize call.
     */
    public RoadConditions resolve(Location origin, List<Location> destinations, Preferences preferences) {
        double traffic = DEFAULT_MULTIPLIER;
        boolean trafficDegraded = false;
        if (trafficProvider != null && preferences.isConsiderTraffic()) {
            try {
                double raw = trafficProvider.getMultiplier(origin, destinations);
                if (isUsable(raw)) {
                    traffic = raw;
                } else {
                    trafficDegraded = true;
                    log.warn("Traffic provider returned unusable multiplier {}, using default {}", raw, DEFAULT_MULTIPLIER);
                }
            } catch (RuntimeException ex) {
                trafficDegraded = true;
                log.warn("Traffic data unavailable, using default multiplier {}: {}", DEFAULT_MULTIPLIER, ex.getMessage());
            }
        }

        double weather = DEFAULT_MULTIPLIER;
        boolean weatherDegraded = false;
        if (weatherProvider != null && preferences.isConsiderWeather()) {
            try {
                double raw = weatherProvider.getImpactMultiplier(origin, destinations);
                if (isUsable(raw)) {
                    weather = Math.min(raw, WeatherImpactModel.MAX_MULTIPLIER);
                } else {
                    weatherDegraded = true;
                    log.warn("Weather provider returned unusable multiplier {}, using default {}", raw, DEFAULT_MULTIPLIER);
                }
            } catch (RuntimeException ex) {
                weatherDegraded = true;
                log.warn("Weather data unavailable, using default multiplier {}: {}", DEFAULT_MULTIPLIER, ex.getMessage());
            }
        }

        return new RoadConditions(traffic, weather, trafficDegraded, weatherDegraded);
    }

    private static boolean isUsable(double multiplier) {
        return Double.isFinite(multiplier) && multiplier > 0.0d;
    }
}
