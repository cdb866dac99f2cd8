package org.greenroute.routing.route;

import org.greenroute.routing.matrix.CostMatrix;
import org.greenroute.routing.model.Stop;
import org.greenroute.routing.solver.Solution;

import java.util.List;

/**
 * Walks a solution and attaches stop metadata, leg costs and running totals.
 *
 * <p>Leg values are read from the same matrices the solver used, never recomputed from
 * coordinates.</p>
 */
public final class RouteAssembler {

    /**
     * Assembles the route for a solution.
     *
     * @param solution depot-first visiting order.
     * @param matrix distance/time matrices the solution was computed on.
     * @param depot synthetic stop for node 0.
     * @param stops destinations for nodes {@code 1..n-1}.
     * @return immutable route.
     * @throws RouteAssemblyException when solution, matrix and stop counts disagree.
     */
    public Route assemble(Solution solution, CostMatrix matrix, Stop depot, List<Stop> stops) {
        int expected = stops.size() + 1;
        if (solution.size() != expected || matrix.size() != expected) {
            throw new RouteAssemblyException(
                    RouteAssemblyException.REASON_SIZE_MISMATCH,
                    "solution size " + solution.size() + ", matrix size " + matrix.size()
                            + " and stop count " + expected + " (depot included) must agree"
            );
        }

        Route.RouteBuilder builder = Route.builder();
        double totalDistance = 0.0d;
        double totalTime = 0.0d;
        int demand = 0;
        for (int position = 0; position < solution.size(); position++) {
            int node = solution.nodeAt(position);
            double legDistance = 0.0d;
            double legTime = 0.0d;
            if (position > 0) {
                int previous = solution.nodeAt(position - 1);
                legDistance = matrix.distanceKm(previous, node);
                legTime = matrix.timeMinutes(previous, node);
                totalDistance += legDistance;
                totalTime += legTime;
                demand++;
            }
            builder.stop(RouteStop.builder()
                    .sequence(position)
                    .nodeIndex(node)
                    .depot(node == 0)
                    .stop(node == 0 ? depot : stops.get(node - 1))
                    .distanceFromPreviousKm(legDistance)
                    .timeFromPreviousMinutes(legTime)
                    .cumulativeDistanceKm(totalDistance)
                    .cumulativeTimeMinutes(totalTime)
                    .cumulativeDemand(demand)
                    .build());
        }

        return builder
                .totalDistanceKm(totalDistance)
                .totalTimeMinutes(totalTime)
                .optimizationSequence(solution.asList())
                .build();
    }
}
