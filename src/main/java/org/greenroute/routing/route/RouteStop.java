package org.greenroute.routing.route;

import lombok.Builder;
import lombok.Value;
import org.greenroute.routing.model.Stop;

/**
 * One visited node of an assembled route.
 */
@Value
@Builder
public class RouteStop {
    /** Position in the route, depot is 0. */
    int sequence;
    /** Matrix node index, depot is 0. */
    int nodeIndex;
    /** Whether this entry is the depot. */
    boolean depot;
    /** Stop metadata; for the depot a synthetic stop carrying the origin. */
    Stop stop;
    /** Leg distance from the previous entry, 0 for the depot. */
    double distanceFromPreviousKm;
    /** Leg time from the previous entry, 0 for the depot. */
    double timeFromPreviousMinutes;
    /** Running distance total up to and including this leg. */
    double cumulativeDistanceKm;
    /** Running time total up to and including this leg. */
    double cumulativeTimeMinutes;
    /** Stops served so far, depot excluded. */
    int cumulativeDemand;
}
