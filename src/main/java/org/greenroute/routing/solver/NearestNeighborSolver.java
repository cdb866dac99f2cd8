package org.greenroute.routing.solver;

import org.greenroute.routing.model.OptimizationQuality;

/**
 * Deterministic nearest-neighbor tour over the distance matrix.
 *
 * <p>Always succeeds and never looks at capacity or duration limits, so its outcomes are
 * tagged {@link OptimizationQuality#HEURISTIC_FALLBACK}. Ties go to the lowest node index.</p>
 */
public final class NearestNeighborSolver implements ConstraintSolver {

    @Override
    public SolverOutcome solve(SolverRequest request) {
        double[][] distance = request.matrix().distanceMatrix();
        Solution solution = solve(distance);
        return SolverOutcome.builder()
                .solution(solution)
                .quality(OptimizationQuality.HEURISTIC_FALLBACK)
                .converged(false)
                .objectiveCost(solution.pathCost(request.matrix().activeMatrix(request.optimizeFor())))
                .strategy(SolverStrategy.GREEDY)
                .build();
    }

    /**
     * Builds the nearest-neighbor visiting order from the depot.
     *
     * @param distanceMatrix square matrix, node 0 is the depot.
     * @return depot-first permutation of all nodes.
     */
    public Solution solve(double[][] distanceMatrix) {
        int n = distanceMatrix.length;
        int[] order = new int[n];
        boolean[] visited = new boolean[n];
        visited[0] = true;
        int current = 0;
        for (int position = 1; position < n; position++) {
            int nearest = -1;
            double nearestDistance = Double.POSITIVE_INFINITY;
            for (int candidate = 1; candidate < n; candidate++) {
                if (visited[candidate]) {
                    continue;
                }
                double d = distanceMatrix[current][candidate];
                if (nearest < 0 || d < nearestDistance) {
                    nearest = candidate;
                    nearestDistance = d;
                }
            }
            order[position] = nearest;
            visited[nearest] = true;
            current = nearest;
        }
        return Solution.of(order);
    }

    @Override
    public SolverStrategy strategy() {
        return SolverStrategy.GREEDY;
    }
}
