package org.greenroute.routing.metrics;

import org.greenroute.routing.model.OptimizationQuality;
import org.greenroute.routing.route.Route;

/**
 * Derives fuel, cost and speed figures from an assembled route.
 *
 * <p>fuel = distance * efficiency / 100; cost = fuel * fuelPrice + hours * driverRate;
 * speed = distance / hours, or 0 for a zero-time route.</p>
 */
public final class MetricsCalculator {

    /**
     * Computes route metrics.
     *
     * @param route assembled route.
     * @param vehicleSpec resolved vehicle spec.
     * @param quality quality flag of the solution behind the route.
     * @return rounded metrics with neutral condition impacts.
     */
    public RouteMetrics compute(Route route, VehicleSpec vehicleSpec, OptimizationQuality quality) {
        double distance = route.getTotalDistanceKm();
        double minutes = route.getTotalTimeMinutes();
        double hours = minutes / 60.0d;

        double efficiency = vehicleSpec.getFuelEfficiencyLPer100km();
        double fuel = efficiency > 0.0d ? distance * efficiency / 100.0d : 0.0d;
        double cost = fuel * vehicleSpec.getFuelPricePerLiter() + hours * vehicleSpec.getDriverHourlyRate();
        double speed = minutes > 0.0d ? distance / hours : 0.0d;

        return RouteMetrics.builder()
                .totalDistanceKm(round2(distance))
                .totalTimeMinutes(round2(minutes))
                .fuelConsumedLiters(round2(fuel))
                .estimatedCostUsd(round2(cost))
                .averageSpeedKmh(round2(speed))
                .optimizationQuality(quality)
                .stopsCount(route.deliveryStopCount())
                .build();
    }

    static double round2(double value) {
        return Math.round(value * 100.0d) / 100.0d;
    }
}
