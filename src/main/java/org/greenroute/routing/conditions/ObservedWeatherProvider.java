package org.greenroute.routing.conditions;

import org.greenroute.routing.geo.Location;

import java.util.List;
import java.util.Objects;

/**
 * Weather provider that observes conditions at the depot and scores them with
 * {@link WeatherImpactModel}.
 *
 * <p>The depot observation stands for the whole route area.</p>
 */
public final class ObservedWeatherProvider implements WeatherProvider {
    private final WeatherObservationSource source;

    public ObservedWeatherProvider(WeatherObservationSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public double getImpactMultiplier(Location origin, List<Location> destinations) {
        return WeatherImpactModel.impactMultiplier(source.observe(origin));
    }

    /**
     * Weather feed lookup for a single coordinate.
     */
    @FunctionalInterface
    public interface WeatherObservationSource {
        WeatherConditions observe(Location location);
    }
}
