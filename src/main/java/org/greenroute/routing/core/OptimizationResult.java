package org.greenroute.routing.core;

import lombok.Builder;
import lombok.Value;
import org.greenroute.routing.metrics.RouteMetrics;
import org.greenroute.routing.route.Route;

import java.time.Instant;

/**
 * Complete result of one optimize call.
 */
@Value
@Builder
public class OptimizationResult {
    /** Random identifier callers use as the store key. */
    String routeId;
    /** Vehicle type the metrics were computed for. */
    String vehicleType;
    /** Ordered route with leg and running totals. */
    Route optimizedRoute;
    /** Aggregate figures and quality flag. */
    RouteMetrics metrics;
    /** Completion time. */
    Instant timestamp;
}
