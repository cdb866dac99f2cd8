package org.greenroute.routing.route;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable ordered route produced from one solution.
 */
@Value
@Builder
public class Route {
    /** Depot followed by stops in visiting order. */
    @Singular
    List<RouteStop> stops;
    /** Sum of leg distances. */
    double totalDistanceKm;
    /** Sum of leg travel times, service time excluded. */
    double totalTimeMinutes;
    /** Visiting order as node indices, depot first. */
    IntList optimizationSequence;

    /**
     * Number of delivery stops, depot excluded.
     */
    public int deliveryStopCount() {
        return Math.max(0, stops.size() - 1);
    }
}
