package org.greenroute.routing.conditions;

import org.greenroute.routing.geo.Location;

import java.util.List;

/**
 * Source of the global weather impact multiplier applied to every time-matrix edge.
 */
@FunctionalInterface
public interface WeatherProvider {
    /**
     * Returns the weather impact multiplier for the route area.
     *
     * @param origin route depot.
     * @param destinations stop coordinates in request order.
     * @return multiplier, {@code 1.0} meaning no impact. Values above
     * {@link WeatherImpactModel#MAX_MULTIPLIER} are capped by the resolver.
     */
    double getImpactMultiplier(Location origin, List<Location> destinations);
}
