package org.greenroute.routing.metrics;

import lombok.Builder;
import lombok.Value;
import org.greenroute.routing.model.OptimizationQuality;

/**
 * Aggregate figures for one assembled route. Numeric values are rounded to 2 decimals.
 */
@Value
@Builder(toBuilder = true)
public class RouteMetrics {
    double totalDistanceKm;
    double totalTimeMinutes;
    double fuelConsumedLiters;
    double estimatedCostUsd;
    double averageSpeedKmh;
    OptimizationQuality optimizationQuality;
    /** Traffic multiplier applied to the time matrix. */
    @Builder.Default
    double trafficImpact = 1.0d;
    /** Weather multiplier applied to the time matrix. */
    @Builder.Default
    double weatherImpact = 1.0d;
    /** Whether {@link #trafficImpact} is a default substituted after a provider failure. */
    boolean trafficDegraded;
    /** Whether {@link #weatherImpact} is a default substituted after a provider failure. */
    boolean weatherDegraded;
    /** Delivery stops, depot excluded. */
    int stopsCount;
    /** Whether the routing search finished inside its deadline. */
    boolean searchConverged;
}
