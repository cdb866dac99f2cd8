package org.greenroute.routing.core;

import lombok.Builder;
import org.greenroute.routing.conditions.ConditionsResolver;
import org.greenroute.routing.conditions.RoadConditions;
import org.greenroute.routing.conditions.TrafficProvider;
import org.greenroute.routing.conditions.WeatherProvider;
import org.greenroute.routing.geo.GeoMetric;
import org.greenroute.routing.geo.Location;
import org.greenroute.routing.matrix.CostMatrix;
import org.greenroute.routing.matrix.MatrixBuilder;
import org.greenroute.routing.metrics.MetricsCalculator;
import org.greenroute.routing.metrics.RouteMetrics;
import org.greenroute.routing.metrics.StaticVehicleSpecTable;
import org.greenroute.routing.metrics.VehicleSpec;
import org.greenroute.routing.metrics.VehicleSpecLookup;
import org.greenroute.routing.model.Constraints;
import org.greenroute.routing.model.OptimizeFor;
import org.greenroute.routing.model.Preferences;
import org.greenroute.routing.model.Stop;
import org.greenroute.routing.route.Route;
import org.greenroute.routing.route.RouteAssembler;
import org.greenroute.routing.route.RouteAssemblyException;
import org.greenroute.routing.solver.ConstraintSolver;
import org.greenroute.routing.solver.NearestNeighborSolver;
import org.greenroute.routing.solver.SearchDeadline;
import org.greenroute.routing.solver.SolverFactory;
import org.greenroute.routing.solver.SolverNonConvergenceException;
import org.greenroute.routing.solver.SolverOutcome;
import org.greenroute.routing.solver.SolverRequest;
import org.greenroute.routing.solver.SolverStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Main route optimization entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request and normalize stop identifiers.</li>
 * <li>Resolve traffic/weather multipliers, substituting defaults on collaborator failure.</li>
 * <li>Build distance and time matrices.</li>
 * <li>Run the configured solver under the request deadline; on non-convergence or any
 * solver failure run the nearest-neighbor fallback instead.</li>
 * <li>Assemble the route from matrix lookups and compute metrics.</li>
 * </ul>
 *
 * <p>The optimizer keeps no per-call state, so one instance serves concurrent calls.</p>
 */
public final class RouteOptimizer implements RouteOptimizerService {
    private static final Logger log = LoggerFactory.getLogger(RouteOptimizer.class);

    public static final String REASON_REQUEST_REQUIRED = "REQUEST_REQUIRED";
    public static final String REASON_ORIGIN_REQUIRED = "ORIGIN_REQUIRED";
    public static final String REASON_COORDINATE_OUT_OF_RANGE = "COORDINATE_OUT_OF_RANGE";
    public static final String REASON_DESTINATIONS_REQUIRED = "DESTINATIONS_REQUIRED";
    public static final String REASON_DESTINATION_REQUIRED = "DESTINATION_REQUIRED";
    public static final String REASON_TOO_MANY_DESTINATIONS = "TOO_MANY_DESTINATIONS";
    public static final String REASON_INVALID_CONSTRAINT = "INVALID_CONSTRAINT";
    public static final String REASON_INVALID_TIME_LIMIT = "INVALID_TIME_LIMIT";
    public static final String REASON_ROUTE_ASSEMBLY_INVARIANT_VIOLATION = "ROUTE_ASSEMBLY_INVARIANT_VIOLATION";
    public static final String REASON_OPTIMIZATION_FAILED = "OPTIMIZATION_FAILED";

    public static final int DEFAULT_MAX_DESTINATIONS = 50;
    static final String PROP_MAX_DESTINATIONS = "greenroute.optimizer.maxDestinations";
    static final String DEPOT_STOP_ID = "depot";

    private final ConditionsResolver conditionsResolver;
    private final MatrixBuilder matrixBuilder = new MatrixBuilder();
    private final ConstraintSolver solver;
    private final NearestNeighborSolver fallbackSolver = new NearestNeighborSolver();
    private final RouteAssembler routeAssembler = new RouteAssembler();
    private final MetricsCalculator metricsCalculator = new MetricsCalculator();
    private final VehicleSpecLookup vehicleSpecLookup;
    private final Duration defaultTimeLimit;
    private final int maxDestinations;
    private final Clock clock;

    /**
     * Creates the optimizer. Every argument is optional.
     *
     * @param trafficProvider traffic collaborator; absent means neutral traffic.
     * @param weatherProvider weather collaborator; absent means neutral weather.
     * @param vehicleSpecLookup vehicle table; defaults to {@link StaticVehicleSpecTable}.
     * @param solverStrategy primary solver; defaults to {@link SolverStrategy#SEARCH}.
     * @param defaultTimeLimit solver budget when the request has none; defaults to
     * {@link SearchDeadline#configuredTimeLimit()}.
     * @param maxDestinations upper bound on stops per request; defaults to the
     * {@value #PROP_MAX_DESTINATIONS} system property or {@value #DEFAULT_MAX_DESTINATIONS}.
     * @param clock result timestamp source.
     */
    @Builder
    public RouteOptimizer(
            TrafficProvider trafficProvider,
            WeatherProvider weatherProvider,
            VehicleSpecLookup vehicleSpecLookup,
            SolverStrategy solverStrategy,
            Duration defaultTimeLimit,
            Integer maxDestinations,
            Clock clock
    ) {
        this.conditionsResolver = new ConditionsResolver(trafficProvider, weatherProvider);
        this.vehicleSpecLookup = vehicleSpecLookup == null ? new StaticVehicleSpecTable() : vehicleSpecLookup;
        this.solver = SolverFactory.create(solverStrategy == null ? SolverStrategy.SEARCH : solverStrategy);
        this.defaultTimeLimit = defaultTimeLimit == null ? SearchDeadline.configuredTimeLimit() : defaultTimeLimit;
        this.maxDestinations = maxDestinations == null || maxDestinations <= 0 ? readMaxDestinations() : maxDestinations;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public OptimizationResult optimize(OptimizeRequest request) {
        validate(request);
        Constraints constraints = request.getConstraints() == null ? Constraints.none() : request.getConstraints();
        Preferences preferences = request.getPreferences() == null ? Preferences.defaults() : request.getPreferences();
        Duration timeLimit = request.getTimeLimit() == null ? defaultTimeLimit : request.getTimeLimit();
        List<Stop> stops = normalizeStops(request.getDestinations());
        Location origin = request.getOrigin();
        OptimizeFor optimizeFor = preferences.getOptimizeFor() == null ? OptimizeFor.TIME : preferences.getOptimizeFor();

        String routeId = UUID.randomUUID().toString();
        log.info("Starting route optimization {}: {} destinations, objective {}", routeId, stops.size(), optimizeFor);

        RoadConditions conditions = conditionsResolver.resolve(origin, locationsOf(stops), preferences);
        CostMatrix matrix = matrixBuilder.build(origin, stops, conditions, preferences);
        trace(routeId, OptimizationStage.MATRIX_BUILT);

        SolverRequest solverRequest = new SolverRequest(matrix, constraints, optimizeFor, SearchDeadline.after(timeLimit));
        trace(routeId, OptimizationStage.SOLVING);
        SolverOutcome outcome = solve(routeId, solverRequest);

        OptimizationStage stage = outcome.getStrategy() == SolverStrategy.SEARCH
                ? OptimizationStage.SOLVED
                : OptimizationStage.FALLBACK;
        trace(routeId, stage);

        String vehicleType = request.getVehicleType() == null
                ? StaticVehicleSpecTable.DEFAULT_VEHICLE_TYPE
                : request.getVehicleType();
        try {
            Stop depot = Stop.builder().stopId(DEPOT_STOP_ID).location(origin).build();
            Route route = routeAssembler.assemble(outcome.getSolution(), matrix, depot, stops);
            stage = OptimizationStage.ASSEMBLED;
            trace(routeId, stage);

            VehicleSpec vehicleSpec = vehicleSpecLookup.lookup(vehicleType);
            RouteMetrics metrics = metricsCalculator.compute(route, vehicleSpec, outcome.getQuality())
                    .toBuilder()
                    .trafficImpact(conditions.getTrafficMultiplier())
                    .weatherImpact(conditions.getWeatherMultiplier())
                    .trafficDegraded(conditions.isTrafficDegraded())
                    .weatherDegraded(conditions.isWeatherDegraded())
                    .searchConverged(outcome.isConverged())
                    .build();
            stage = OptimizationStage.METRICS_COMPUTED;
            trace(routeId, stage);

            OptimizationResult result = OptimizationResult.builder()
                    .routeId(routeId)
                    .vehicleType(vehicleType)
                    .optimizedRoute(route)
                    .metrics(metrics)
                    .timestamp(clock.instant())
                    .build();
            trace(routeId, OptimizationStage.DONE);
            log.info("Route optimization {} completed: quality={} objective={} distanceKm={} timeMin={}",
                    routeId, metrics.getOptimizationQuality().wireName(), outcome.getObjectiveCost(),
                    metrics.getTotalDistanceKm(), metrics.getTotalTimeMinutes());
            return result;
        } catch (RouteAssemblyException ex) {
            log.error("Route optimization {} failed in stage {}: {}", routeId, stage, ex.getMessage());
            throw new RouteOptimizationException(
                    REASON_ROUTE_ASSEMBLY_INVARIANT_VIOLATION,
                    stage,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        } catch (RuntimeException ex) {
            log.error("Route optimization {} failed in stage {}", routeId, stage, ex);
            throw new RouteOptimizationException(
                    REASON_OPTIMIZATION_FAILED,
                    stage,
                    "optimization failed after " + stage + ": " + ex.getMessage(),
                    ex
            );
        }
    }

    /**
     * Runs the primary solver and falls back to nearest neighbor when it cannot deliver.
     */
    private SolverOutcome solve(String routeId, SolverRequest request) {
        try {
            return solver.solve(request);
        } catch (SolverNonConvergenceException ex) {
            log.warn("Route {}: solver did not converge ({}), using nearest-neighbor fallback", routeId, ex.reasonCode());
        } catch (RuntimeException ex) {
            log.error("Route {}: solver failed, using nearest-neighbor fallback", routeId, ex);
        }
        return fallbackSolver.solve(request);
    }

    private void validate(OptimizeRequest request) {
        if (request == null) {
            throw invalid(REASON_REQUEST_REQUIRED, "optimize request must be provided");
        }
        if (request.getOrigin() == null) {
            throw invalid(REASON_ORIGIN_REQUIRED, "origin must be provided");
        }
        if (!GeoMetric.isValid(request.getOrigin())) {
            throw invalid(REASON_COORDINATE_OUT_OF_RANGE, "origin out of range: " + request.getOrigin());
        }
        List<Stop> destinations = request.getDestinations();
        if (destinations == null || destinations.isEmpty()) {
            throw invalid(REASON_DESTINATIONS_REQUIRED, "destinations must be non-empty");
        }
        if (destinations.size() > maxDestinations) {
            throw invalid(
                    REASON_TOO_MANY_DESTINATIONS,
                    "at most " + maxDestinations + " destinations per route, got " + destinations.size()
            );
        }
        for (int i = 0; i < destinations.size(); i++) {
            Stop stop = destinations.get(i);
            if (stop == null || stop.getLocation() == null) {
                throw invalid(REASON_DESTINATION_REQUIRED, "destinations[" + i + "] must have a location");
            }
            if (!GeoMetric.isValid(stop.getLocation())) {
                throw invalid(REASON_COORDINATE_OUT_OF_RANGE, "destinations[" + i + "] out of range: " + stop.getLocation());
            }
            if (stop.getServiceTimeMinutes() != null && stop.getServiceTimeMinutes() < 0) {
                throw invalid(REASON_INVALID_CONSTRAINT, "destinations[" + i + "].serviceTimeMinutes must be >= 0");
            }
        }
        Constraints constraints = request.getConstraints();
        if (constraints != null) {
            if (constraints.hasCapacityLimit() && constraints.getMaxCapacity() <= 0) {
                throw invalid(REASON_INVALID_CONSTRAINT, "maxCapacity must be > 0, got " + constraints.getMaxCapacity());
            }
            if (constraints.hasDurationLimit() && constraints.getMaxDurationMinutes() <= 0) {
                throw invalid(
                        REASON_INVALID_CONSTRAINT,
                        "maxDurationMinutes must be > 0, got " + constraints.getMaxDurationMinutes()
                );
            }
        }
        Duration timeLimit = request.getTimeLimit();
        if (timeLimit != null && (timeLimit.isZero() || timeLimit.isNegative())) {
            throw invalid(REASON_INVALID_TIME_LIMIT, "timeLimit must be positive, got " + timeLimit);
        }
    }

    private static RouteOptimizationException invalid(String reasonCode, String message) {
        return new RouteOptimizationException(reasonCode, OptimizationStage.INIT, message);
    }

    /**
     * Fills missing stop ids with {@code stop-<n>}, 1-based in request order.
     */
    private static List<Stop> normalizeStops(List<Stop> destinations) {
        List<Stop> stops = new ArrayList<>(destinations.size());
        for (int i = 0; i < destinations.size(); i++) {
            Stop stop = destinations.get(i);
            if (stop.getStopId() == null || stop.getStopId().isBlank()) {
                stop = stop.toBuilder().stopId("stop-" + (i + 1)).build();
            }
            stops.add(stop);
        }
        return List.copyOf(stops);
    }

    private static List<Location> locationsOf(List<Stop> stops) {
        List<Location> locations = new ArrayList<>(stops.size());
        for (Stop stop : stops) {
            locations.add(stop.getLocation());
        }
        return locations;
    }

    private static void trace(String routeId, OptimizationStage stage) {
        log.debug("Route {} entered stage {}", routeId, stage);
    }

    private static int readMaxDestinations() {
        String raw = System.getProperty(PROP_MAX_DESTINATIONS);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_DESTINATIONS;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : DEFAULT_MAX_DESTINATIONS;
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_DESTINATIONS;
        }
    }
}
