package org.greenroute.routing.solver;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Signals that the constraint solver could not produce any feasible incumbent.
 *
 * <p>Callers recover by switching to {@link NearestNeighborSolver}; this exception is never
 * meant to reach API clients.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SolverNonConvergenceException extends RuntimeException {
    public static final String REASON_NO_DESTINATIONS = "SOLVER_NO_DESTINATIONS";
    public static final String REASON_CAPACITY_INFEASIBLE = "SOLVER_CAPACITY_INFEASIBLE";
    public static final String REASON_DURATION_INFEASIBLE = "SOLVER_DURATION_INFEASIBLE";
    public static final String REASON_DEADLINE_BEFORE_INCUMBENT = "SOLVER_DEADLINE_BEFORE_INCUMBENT";
    public static final String REASON_NO_SOLUTION = "SOLVER_NO_SOLUTION";

    private final String reasonCode;

    public SolverNonConvergenceException(String reasonCode, String message) {
        super("[" + reasonCode + "] " + message);
        this.reasonCode = reasonCode;
    }
}
