package org.greenroute.routing.solver;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.main;
import com.google.protobuf.Duration;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.greenroute.routing.matrix.CostMatrix;
import org.greenroute.routing.model.Constraints;
import org.greenroute.routing.model.OptimizationQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constraint-aware solver backed by the OR-Tools routing library.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Scale the active matrix to integer arc costs (x{@value #COST_SCALE}, truncated).</li>
 * <li>Model one vehicle starting at node 0. Arcs back to the depot cost nothing, so the
 * objective is the open path the route reports.</li>
 * <li>Add a capacity dimension (one unit per stop) and a transit-time dimension bounded by
 * the duration limit plus {@value TourFeasibility#WAITING_SLACK_MINUTES} minutes.</li>
 * <li>Search with {@code PATH_CHEAPEST_ARC} and greedy-descent local search, limited to the
 * remaining deadline budget.</li>
 * <li>Keep the nearest-neighbor tour instead when it is feasible and cheaper, or when the
 * search found no assignment.</li>
 * </ul>
 *
 * <p>When neither yields a feasible tour the call raises {@link SolverNonConvergenceException}.
 * Each call builds its own model, so one instance serves concurrent calls.</p>
 */
public final class RoutingModelSolver implements ConstraintSolver {
    private static final Logger log = LoggerFactory.getLogger(RoutingModelSolver.class);

    static final int COST_SCALE = 100;

    private static final int VEHICLES = 1;
    private static final int DEPOT = 0;
    private static final String CAPACITY_DIMENSION = "Capacity";
    private static final String TIME_DIMENSION = "Time";

    static {
        Loader.loadNativeLibraries();
    }

    private final NearestNeighborSolver referenceTour = new NearestNeighborSolver();

    @Override
    public SolverOutcome solve(SolverRequest request) {
        CostMatrix matrix = request.matrix();
        int n = matrix.size();
        if (n < 2) {
            throw new SolverNonConvergenceException(
                    SolverNonConvergenceException.REASON_NO_DESTINATIONS,
                    "no destinations to construct a tour over"
            );
        }
        Constraints constraints = request.constraints();
        if (constraints.hasCapacityLimit() && constraints.getMaxCapacity() < n - 1) {
            throw new SolverNonConvergenceException(
                    SolverNonConvergenceException.REASON_CAPACITY_INFEASIBLE,
                    "capacity " + constraints.getMaxCapacity() + " cannot cover " + (n - 1) + " stops"
            );
        }

        SearchDeadline deadline = request.deadline();
        java.time.Duration remaining = deadline.remaining();
        if (remaining.isZero()) {
            throw deadlinePassed(deadline);
        }

        double[][] active = matrix.activeMatrix(request.optimizeFor());
        long[][] arcCost = scale(active);

        RoutingIndexManager manager = new RoutingIndexManager(n, VEHICLES, DEPOT);
        RoutingModel routing = new RoutingModel(manager);
        int costCallback = routing.registerTransitCallback((long fromIndex, long toIndex) -> {
            int to = manager.indexToNode(toIndex);
            return to == DEPOT ? 0L : arcCost[manager.indexToNode(fromIndex)][to];
        });
        routing.setArcCostEvaluatorOfAllVehicles(costCallback);

        if (constraints.hasCapacityLimit()) {
            int demandCallback = routing.registerUnaryTransitCallback(
                    (long fromIndex) -> TourFeasibility.demandOf(manager.indexToNode(fromIndex)));
            routing.addDimensionWithVehicleCapacity(
                    demandCallback,
                    0L,
                    new long[]{constraints.getMaxCapacity()},
                    true,
                    CAPACITY_DIMENSION
            );
        }

        if (constraints.hasDurationLimit()) {
            long[][] transit = scaleUp(matrix.timeMatrix());
            int timeCallback = routing.registerTransitCallback((long fromIndex, long toIndex) -> {
                int to = manager.indexToNode(toIndex);
                return to == DEPOT ? 0L : transit[manager.indexToNode(fromIndex)][to];
            });
            long horizon = ((long) constraints.getMaxDurationMinutes() + TourFeasibility.WAITING_SLACK_MINUTES) * COST_SCALE;
            routing.addDimension(timeCallback, 0L, horizon, true, TIME_DIMENSION);
        }

        RoutingSearchParameters parameters = main.defaultRoutingSearchParameters()
                .toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
                .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GREEDY_DESCENT)
                .setTimeLimit(Duration.newBuilder()
                        .setSeconds(remaining.getSeconds())
                        .setNanos(remaining.getNano())
                        .build())
                .build();

        Assignment assignment = routing.solveWithParameters(parameters);
        boolean converged = !deadline.isExpired();

        TourFeasibility feasibility = new TourFeasibility(matrix, constraints);
        Solution reference = referenceTour.solve(matrix.distanceMatrix());
        boolean referenceFeasible = feasibility.isFeasible(reference.toArray());
        double referenceCost = reference.pathCost(active);

        Solution incumbent;
        double incumbentCost;
        if (assignment == null) {
            if (!referenceFeasible) {
                throw noAssignment(deadline, constraints);
            }
            log.debug("Routing search found no assignment, keeping feasible nearest-neighbor tour");
            incumbent = reference;
            incumbentCost = referenceCost;
        } else {
            incumbent = Solution.of(extractTour(manager, routing, assignment));
            incumbentCost = incumbent.pathCost(active);
            if (referenceFeasible && referenceCost < incumbentCost) {
                log.debug("Nearest-neighbor tour {} beats routing search {}, keeping it", referenceCost, incumbentCost);
                incumbent = reference;
                incumbentCost = referenceCost;
            }
        }

        log.debug("Routing search finished: nodes={} converged={} cost={} elapsedMs={}",
                n, converged, incumbentCost, deadline.elapsedNanos() / 1_000_000L);

        return SolverOutcome.builder()
                .solution(incumbent)
                .quality(OptimizationQuality.OPTIMAL)
                .converged(converged)
                .objectiveCost(incumbentCost)
                .strategy(SolverStrategy.SEARCH)
                .build();
    }

    @Override
    public SolverStrategy strategy() {
        return SolverStrategy.SEARCH;
    }

    /**
     * Truncates {@code value * 100} to {@code long} for every entry.
     */
    static long[][] scale(double[][] matrix) {
        int n = matrix.length;
        long[][] scaled = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                scaled[i][j] = (long) (matrix[i][j] * COST_SCALE);
            }
        }
        return scaled;
    }

    /**
     * Rounds {@code value * 100} up, so a tour inside the scaled horizon is inside the real one.
     */
    static long[][] scaleUp(double[][] matrix) {
        int n = matrix.length;
        long[][] scaled = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                scaled[i][j] = (long) Math.ceil(matrix[i][j] * COST_SCALE);
            }
        }
        return scaled;
    }

    private static int[] extractTour(RoutingIndexManager manager, RoutingModel routing, Assignment assignment) {
        IntArrayList tour = new IntArrayList();
        long index = routing.start(0);
        while (!routing.isEnd(index)) {
            tour.add(manager.indexToNode(index));
            index = assignment.value(routing.nextVar(index));
        }
        return tour.toIntArray();
    }

    private static SolverNonConvergenceException noAssignment(SearchDeadline deadline, Constraints constraints) {
        if (deadline.isExpired()) {
            return deadlinePassed(deadline);
        }
        if (constraints.hasDurationLimit()) {
            return new SolverNonConvergenceException(
                    SolverNonConvergenceException.REASON_DURATION_INFEASIBLE,
                    "no tour fits " + constraints.getMaxDurationMinutes() + " min (+"
                            + TourFeasibility.WAITING_SLACK_MINUTES + " min slack) of transit"
            );
        }
        return new SolverNonConvergenceException(
                SolverNonConvergenceException.REASON_NO_SOLUTION,
                "routing search returned no assignment"
        );
    }

    private static SolverNonConvergenceException deadlinePassed(SearchDeadline deadline) {
        return new SolverNonConvergenceException(
                SolverNonConvergenceException.REASON_DEADLINE_BEFORE_INCUMBENT,
                "deadline of " + deadline.budget().toMillis() + " ms passed before a first tour was found"
        );
    }
}
