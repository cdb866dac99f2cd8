package org.greenroute.routing.solver;

import lombok.experimental.UtilityClass;

/**
 * Creates solver implementations by strategy.
 */
@UtilityClass
public final class SolverFactory {

    /**
     * Returns the solver for a strategy.
     *
     * @throws IllegalArgumentException when strategy is {@code null}.
     */
    public static ConstraintSolver create(SolverStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("solver strategy must be explicitly specified (SEARCH, GREEDY)");
        }
        return switch (strategy) {
            case SEARCH -> new RoutingModelSolver();
            case GREEDY -> new NearestNeighborSolver();
        };
    }
}
