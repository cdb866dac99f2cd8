package org.greenroute.app;

import org.greenroute.routing.conditions.ObservedWeatherProvider;
import org.greenroute.routing.conditions.TimeOfDayTrafficProvider;
import org.greenroute.routing.conditions.WeatherConditions;
import org.greenroute.routing.core.OptimizationResult;
import org.greenroute.routing.core.OptimizeRequest;
import org.greenroute.routing.core.RouteOptimizer;
import org.greenroute.routing.geo.Location;
import org.greenroute.routing.metrics.RouteMetrics;
import org.greenroute.routing.model.Stop;
import org.greenroute.routing.route.RouteStop;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Optimizes a fixed lower-Manhattan delivery round and prints the route and metrics.</p>
 */
public class Main {
    /**
     * Launches the sample optimization.
     *
     * @param args optional vehicle type as first argument.
     */
    public static void main(String[] args) {
        String vehicleType = args.length > 0 ? args[0] : "diesel_truck";

        RouteOptimizer optimizer = RouteOptimizer.builder()
                .trafficProvider(new TimeOfDayTrafficProvider(Clock.systemDefaultZone()))
                .weatherProvider(new ObservedWeatherProvider(location -> WeatherConditions.builder().build()))
                .defaultTimeLimit(Duration.ofSeconds(5))
                .build();

        OptimizeRequest request = OptimizeRequest.builder()
                .origin(Location.of(40.7128, -74.0060))
                .destination(Stop.builder().stopId("times-square").location(Location.of(40.7589, -73.9851)).build())
                .destination(Stop.builder().stopId("liberty-island").location(Location.of(40.6892, -74.0445)).priority(2).build())
                .destination(Stop.builder().stopId("penn-station").location(Location.of(40.7505, -73.9934)).build())
                .destination(Stop.builder().stopId("jamaica").location(Location.of(40.7282, -73.7949)).priority(3).build())
                .vehicleType(vehicleType)
                .build();

        OptimizationResult result = optimizer.optimize(request);

        System.out.println("route_id = " + result.getRouteId());
        for (RouteStop stop : result.getOptimizedRoute().getStops()) {
            System.out.println(String.format(Locale.ROOT, "%d. %s (+%.2f km, +%.2f min)",
                    stop.getSequence(),
                    stop.getStop().getStopId(),
                    stop.getDistanceFromPreviousKm(),
                    stop.getTimeFromPreviousMinutes()));
        }
        RouteMetrics metrics = result.getMetrics();
        System.out.println("optimization_sequence = " + result.getOptimizedRoute().getOptimizationSequence());
        System.out.println(String.format(Locale.ROOT, "total_distance_km = %.2f", metrics.getTotalDistanceKm()));
        System.out.println(String.format(Locale.ROOT, "total_time_minutes = %.2f", metrics.getTotalTimeMinutes()));
        System.out.println(String.format(Locale.ROOT, "fuel_consumed_liters = %.2f", metrics.getFuelConsumedLiters()));
        System.out.println(String.format(Locale.ROOT, "estimated_cost_usd = %.2f", metrics.getEstimatedCostUsd()));
        System.out.println("optimization_quality = " + metrics.getOptimizationQuality().wireName());
    }
}
