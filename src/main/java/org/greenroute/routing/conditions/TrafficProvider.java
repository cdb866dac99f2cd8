package org.greenroute.routing.conditions;

import org.greenroute.routing.geo.Location;

import java.util.List;

/**
 * Source of the global traffic multiplier applied to every time-matrix edge.
 *
 * <p>Implementations may throw any runtime exception when their data source is
 * unavailable; {@link ConditionsResolver} substitutes the neutral default.</p>
 */
@FunctionalInterface
public interface TrafficProvider {
    /**
     * Returns the traffic multiplier for the area spanned by origin and destinations.
     *
     * @param origin route depot.
     * @param destinations stop coordinates in request order.
     * @return multiplier, {@code 1.0} meaning free flow.
     */
    double getMultiplier(Location origin, List<Location> destinations);
}
