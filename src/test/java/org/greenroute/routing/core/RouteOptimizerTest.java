package org.greenroute.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;
import org.greenroute.routing.geo.Location;
import org.greenroute.routing.model.Constraints;
import org.greenroute.routing.model.OptimizationQuality;
import org.greenroute.routing.model.OptimizeFor;
import org.greenroute.routing.model.Preferences;
import org.greenroute.routing.model.Stop;
import org.greenroute.routing.route.Route;
import org.greenroute.routing.route.RouteStop;
import org.greenroute.routing.solver.SolverStrategy;
import org.greenroute.testutil.RouteFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.function.Executable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RouteOptimizer Tests")
class RouteOptimizerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @AfterEach
    void clearProperty() {
        System.clearProperty(RouteOptimizer.PROP_MAX_DESTINATIONS);
    }

    @Test
    @DisplayName("Manhattan two-stop request yields an optimal route with consistent totals")
    void testManhattanEndToEnd() {
        RouteOptimizer optimizer = optimizer().build();

        OptimizationResult result = optimizer.optimize(RouteFixtures.manhattanRequest().build());

        Route route = result.getOptimizedRoute();
        assertEquals(3, route.getStops().size());
        assertTrue(route.getStops().get(0).isDepot());
        assertEquals(RouteOptimizer.DEPOT_STOP_ID, route.getStops().get(0).getStop().getStopId());
        assertPermutation(route.getOptimizationSequence(), 3);
        assertEquals(OptimizationQuality.OPTIMAL, result.getMetrics().getOptimizationQuality());
        assertTrue(result.getMetrics().isSearchConverged());
        assertFalse(result.getMetrics().isTrafficDegraded());
        assertFalse(result.getMetrics().isWeatherDegraded());
        assertEquals(2, result.getMetrics().getStopsCount());
        assertEquals("diesel_truck", result.getVehicleType());
        assertEquals(NOW, result.getTimestamp());
        assertEquals(result.getRouteId(), UUID.fromString(result.getRouteId()).toString());

        double legSum = 0.0d;
        for (RouteStop stop : route.getStops()) {
            legSum += stop.getDistanceFromPreviousKm();
        }
        assertEquals(route.getTotalDistanceKm(), legSum, 1e-9);
        assertEquals(Math.round(route.getTotalDistanceKm() * 100.0d) / 100.0d, result.getMetrics().getTotalDistanceKm(), 0.0d);
        assertTrue(route.getTotalDistanceKm() > 5.0d);
    }

    @Test
    @DisplayName("Missing stop ids are filled by request position, given ids are kept")
    void testStopIdNormalization() {
        OptimizationResult result = optimizer().build().optimize(OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destination(Stop.builder().location(RouteFixtures.TIMES_SQUARE).build())
                .destination(Stop.builder().stopId("liberty").location(RouteFixtures.LIBERTY_ISLAND).build())
                .build());

        List<String> ids = new ArrayList<>();
        for (RouteStop stop : result.getOptimizedRoute().getStops()) {
            if (!stop.isDepot()) {
                ids.add(stop.getNodeIndex() + "=" + stop.getStop().getStopId());
            }
        }
        assertTrue(ids.contains("1=stop-1"));
        assertTrue(ids.contains("2=liberty"));
    }

    @Test
    @DisplayName("Every call gets a fresh route id")
    void testRouteIdsUnique() {
        RouteOptimizer optimizer = optimizer().build();
        OptimizeRequest request = RouteFixtures.manhattanRequest().build();
        assertNotEquals(optimizer.optimize(request).getRouteId(), optimizer.optimize(request).getRouteId());
    }

    @Test
    @DisplayName("Capacity below stop count falls back to nearest neighbor deterministically")
    void testCapacityFallback() {
        RouteOptimizer optimizer = optimizer().build();
        OptimizeRequest request = RouteFixtures.manhattanRequest()
                .constraints(Constraints.builder().maxCapacity(1).build())
                .build();

        OptimizationResult first = optimizer.optimize(request);
        OptimizationResult second = optimizer.optimize(request);

        assertEquals(OptimizationQuality.HEURISTIC_FALLBACK, first.getMetrics().getOptimizationQuality());
        assertFalse(first.getMetrics().isSearchConverged());
        assertEquals(3, first.getOptimizedRoute().getStops().size());
        assertEquals(first.getOptimizedRoute().getOptimizationSequence(), second.getOptimizedRoute().getOptimizationSequence());
    }

    @Test
    @DisplayName("Optimal results honor capacity and duration limits")
    void testOptimalHonorsConstraints() {
        List<Stop> stops = RouteFixtures.randomStops(21L, 6);
        OptimizeRequest request = OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destinations(stops)
                .constraints(Constraints.builder().maxCapacity(6).maxDurationMinutes(600).build())
                .build();

        OptimizationResult result = optimizer().build().optimize(request);

        assertEquals(OptimizationQuality.OPTIMAL, result.getMetrics().getOptimizationQuality());
        RouteStop last = result.getOptimizedRoute().getStops().get(6);
        assertTrue(last.getCumulativeDemand() <= 6);
        assertTrue(last.getCumulativeTimeMinutes() <= 600 + 30);
    }

    @Test
    @DisplayName("Unreachable duration limit falls back instead of failing")
    void testDurationFallback() {
        OptimizationResult result = optimizer().build().optimize(RouteFixtures.manhattanRequest()
                .constraints(Constraints.builder().maxDurationMinutes(1).build())
                .destination(Stop.builder().location(Location.of(40.9, -73.7)).build())
                .build());

        assertEquals(OptimizationQuality.HEURISTIC_FALLBACK, result.getMetrics().getOptimizationQuality());
        assertEquals(4, result.getOptimizedRoute().getStops().size());
    }

    @Test
    @DisplayName("Service time does not count against the duration limit")
    void testServiceTimeExcludedFromDuration() {
        OptimizeRequest request = OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destination(Stop.builder().location(RouteFixtures.TIMES_SQUARE).serviceTimeMinutes(60).build())
                .destination(Stop.builder().location(RouteFixtures.LIBERTY_ISLAND).serviceTimeMinutes(60).build())
                .constraints(Constraints.builder().maxDurationMinutes(60).build())
                .build();

        OptimizationResult result = optimizer().build().optimize(request);

        assertEquals(OptimizationQuality.OPTIMAL, result.getMetrics().getOptimizationQuality());
        assertTrue(result.getOptimizedRoute().getTotalTimeMinutes() <= 60 + 30);
    }

    @Test
    @DisplayName("Null objective in preferences is treated as TIME")
    void testNullObjectiveDefaultsToTime() {
        RouteOptimizer optimizer = optimizer().build();
        OptimizeRequest.OptimizeRequestBuilder request = OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destinations(RouteFixtures.randomStops(31L, 8));

        OptimizationResult unset = optimizer.optimize(request
                .preferences(Preferences.builder().optimizeFor(null).build())
                .build());
        OptimizationResult byTime = optimizer.optimize(request
                .preferences(Preferences.builder().optimizeFor(OptimizeFor.TIME).build())
                .build());

        assertEquals(OptimizationQuality.OPTIMAL, unset.getMetrics().getOptimizationQuality());
        assertEquals(byTime.getOptimizedRoute().getOptimizationSequence(), unset.getOptimizedRoute().getOptimizationSequence());
    }

    @Test
    @DisplayName("Search result is never longer than the greedy route on the distance objective")
    void testSearchDominatesGreedy() {
        Preferences byDistance = Preferences.builder().optimizeFor(OptimizeFor.DISTANCE).build();
        OptimizeRequest request = OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destinations(RouteFixtures.randomStops(8L, 15))
                .preferences(byDistance)
                .build();

        OptimizationResult search = optimizer().build().optimize(request);
        OptimizationResult greedy = optimizer().solverStrategy(SolverStrategy.GREEDY).build().optimize(request);

        assertEquals(OptimizationQuality.OPTIMAL, search.getMetrics().getOptimizationQuality());
        assertEquals(OptimizationQuality.HEURISTIC_FALLBACK, greedy.getMetrics().getOptimizationQuality());
        assertTrue(search.getOptimizedRoute().getTotalDistanceKm() <= greedy.getOptimizedRoute().getTotalDistanceKm() + 1e-9);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("One-millisecond budget returns a complete route promptly")
    void testTinyTimeLimit() {
        assertTinyBudgetHonored(Constraints.none());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("One-millisecond budget with a duration limit returns a complete route promptly")
    void testTinyTimeLimitWithDuration() {
        assertTinyBudgetHonored(Constraints.builder().maxDurationMinutes(600).build());
    }

    private static void assertTinyBudgetHonored(Constraints constraints) {
        RouteOptimizer optimizer = optimizer().build();
        OptimizeRequest request = OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destinations(RouteFixtures.randomStops(13L, 50))
                .constraints(constraints)
                .timeLimit(Duration.ofMillis(1))
                .build();
        // first call pays native library and class loading
        optimizer.optimize(request);

        long started = System.nanoTime();
        OptimizationResult result = optimizer.optimize(request);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(51, result.getOptimizedRoute().getStops().size());
        assertPermutation(result.getOptimizedRoute().getOptimizationSequence(), 51);
        assertTrue(elapsedMillis < 2_000L, "1 ms budget took " + elapsedMillis + " ms");
    }

    @Test
    @DisplayName("Traffic and weather scale travel time and are reported in metrics")
    void testConditionsApplied() {
        RouteOptimizer neutral = optimizer().build();
        RouteOptimizer congested = optimizer()
                .trafficProvider((origin, destinations) -> 1.4d)
                .weatherProvider((origin, destinations) -> 1.5d)
                .build();
        OptimizeRequest request = RouteFixtures.manhattanRequest()
                .preferences(Preferences.builder().optimizeFor(OptimizeFor.DISTANCE).build())
                .build();

        OptimizationResult base = neutral.optimize(request);
        OptimizationResult slow = congested.optimize(request);

        assertEquals(1.4d, slow.getMetrics().getTrafficImpact(), 0.0d);
        assertEquals(1.5d, slow.getMetrics().getWeatherImpact(), 0.0d);
        assertEquals(base.getOptimizedRoute().getTotalDistanceKm(), slow.getOptimizedRoute().getTotalDistanceKm(), 1e-9);
        assertEquals(base.getOptimizedRoute().getTotalTimeMinutes() * 2.1d, slow.getOptimizedRoute().getTotalTimeMinutes(), 1e-6);
    }

    @Test
    @DisplayName("Failing collaborators degrade to neutral multipliers")
    void testCollaboratorFailure() {
        RouteOptimizer optimizer = optimizer()
                .trafficProvider((origin, destinations) -> {
                    throw new IllegalStateException("traffic feed down");
                })
                .weatherProvider((origin, destinations) -> {
                    throw new IllegalStateException("weather feed down");
                })
                .build();

        OptimizationResult result = optimizer.optimize(RouteFixtures.manhattanRequest().build());

        assertEquals(1.0d, result.getMetrics().getTrafficImpact(), 0.0d);
        assertEquals(1.0d, result.getMetrics().getWeatherImpact(), 0.0d);
        assertTrue(result.getMetrics().isTrafficDegraded());
        assertTrue(result.getMetrics().isWeatherDegraded());
        assertEquals(OptimizationQuality.OPTIMAL, result.getMetrics().getOptimizationQuality());
    }

    @Test
    @DisplayName("Unknown vehicle types are costed as diesel trucks")
    void testUnknownVehicle() {
        OptimizationResult result = optimizer().build().optimize(RouteFixtures.manhattanRequest().vehicleType("hovercraft").build());

        double expectedFuel = result.getOptimizedRoute().getTotalDistanceKm() * 35.0d / 100.0d;
        assertEquals(Math.round(expectedFuel * 100.0d) / 100.0d, result.getMetrics().getFuelConsumedLiters(), 0.0d);
    }

    @Test
    @DisplayName("Validation failures carry reason codes and the INIT stage")
    void testValidation() {
        RouteOptimizer optimizer = optimizer().build();
        List<Stop> tooMany = RouteFixtures.randomStops(1L, RouteOptimizer.DEFAULT_MAX_DESTINATIONS + 1);

        assertRejected(RouteOptimizer.REASON_REQUEST_REQUIRED, () -> optimizer.optimize(null));
        assertRejected(RouteOptimizer.REASON_ORIGIN_REQUIRED,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest().origin(null).build()));
        assertRejected(RouteOptimizer.REASON_COORDINATE_OUT_OF_RANGE,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest().origin(Location.of(91.0d, 0.0d)).build()));
        assertRejected(RouteOptimizer.REASON_COORDINATE_OUT_OF_RANGE,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest()
                        .destination(Stop.builder().location(Location.of(0.0d, Double.NaN)).build()).build()));
        assertRejected(RouteOptimizer.REASON_DESTINATIONS_REQUIRED,
                () -> optimizer.optimize(OptimizeRequest.builder().origin(RouteFixtures.NYC_DEPOT).build()));
        assertRejected(RouteOptimizer.REASON_DESTINATION_REQUIRED,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest().destination(Stop.builder().build()).build()));
        assertRejected(RouteOptimizer.REASON_TOO_MANY_DESTINATIONS,
                () -> optimizer.optimize(OptimizeRequest.builder().origin(RouteFixtures.NYC_DEPOT).destinations(tooMany).build()));
        assertRejected(RouteOptimizer.REASON_INVALID_CONSTRAINT,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest()
                        .constraints(Constraints.builder().maxCapacity(0).build()).build()));
        assertRejected(RouteOptimizer.REASON_INVALID_CONSTRAINT,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest()
                        .constraints(Constraints.builder().maxDurationMinutes(-5).build()).build()));
        assertRejected(RouteOptimizer.REASON_INVALID_CONSTRAINT,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest()
                        .destination(Stop.builder().location(RouteFixtures.NYC_DEPOT).serviceTimeMinutes(-1).build()).build()));
        assertRejected(RouteOptimizer.REASON_INVALID_TIME_LIMIT,
                () -> optimizer.optimize(RouteFixtures.manhattanRequest().timeLimit(Duration.ZERO).build()));
    }

    @Test
    @DisplayName("Destination limit comes from the builder or the system property")
    void testDestinationLimitConfiguration() {
        OptimizeRequest threeStops = RouteFixtures.manhattanRequest()
                .destination(Stop.builder().location(Location.of(40.75, -73.99)).build())
                .build();

        assertRejected(RouteOptimizer.REASON_TOO_MANY_DESTINATIONS,
                () -> optimizer().maxDestinations(2).build().optimize(threeStops));

        System.setProperty(RouteOptimizer.PROP_MAX_DESTINATIONS, "2");
        assertRejected(RouteOptimizer.REASON_TOO_MANY_DESTINATIONS, () -> optimizer().build().optimize(threeStops));

        System.setProperty(RouteOptimizer.PROP_MAX_DESTINATIONS, "many");
        assertEquals(4, optimizer().build().optimize(threeStops).getOptimizedRoute().getStops().size());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent calls on one optimizer agree with a sequential call")
    void testConcurrentOptimize() throws Exception {
        RouteOptimizer optimizer = optimizer().build();
        OptimizeRequest request = OptimizeRequest.builder()
                .origin(RouteFixtures.NYC_DEPOT)
                .destinations(RouteFixtures.randomStops(77L, 12))
                .build();
        IntList expected = optimizer.optimize(request).getOptimizedRoute().getOptimizationSequence();

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<OptimizationResult>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return optimizer.optimize(request);
                }));
            }
            start.countDown();
            for (Future<OptimizationResult> future : futures) {
                OptimizationResult result = future.get();
                assertEquals(OptimizationQuality.OPTIMAL, result.getMetrics().getOptimizationQuality());
                assertEquals(expected, result.getOptimizedRoute().getOptimizationSequence());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static RouteOptimizer.RouteOptimizerBuilder optimizer() {
        return RouteOptimizer.builder()
                .defaultTimeLimit(Duration.ofSeconds(10))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static void assertRejected(String reasonCode, Executable call) {
        RouteOptimizationException ex = assertThrows(RouteOptimizationException.class, call);
        assertEquals(reasonCode, ex.getReasonCode());
        assertEquals(OptimizationStage.INIT, ex.getStage());
        assertTrue(ex.getMessage().startsWith("[" + reasonCode + "]"));
    }

    private static void assertPermutation(IntList sequence, int size) {
        assertEquals(size, sequence.size());
        assertEquals(0, sequence.getInt(0));
        boolean[] seen = new boolean[size];
        for (int i = 0; i < size; i++) {
            int node = sequence.getInt(i);
            assertFalse(seen[node], "repeated node " + node);
            seen[node] = true;
        }
    }
}
