package org.greenroute.routing.solver;

import org.greenroute.routing.matrix.CostMatrix;
import org.greenroute.routing.model.Constraints;
import org.greenroute.routing.model.OptimizeFor;

import java.util.Objects;

/**
 * Normalized solver input for one optimize call.
 *
 * @param matrix distance/time matrices, node 0 is the depot.
 * @param constraints capacity/duration limits.
 * @param optimizeFor objective selector.
 * @param deadline wall-clock budget.
 */
public record SolverRequest(
        CostMatrix matrix,
        Constraints constraints,
        OptimizeFor optimizeFor,
        SearchDeadline deadline
) {
    public SolverRequest {
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(constraints, "constraints");
        Objects.requireNonNull(optimizeFor, "optimizeFor");
        Objects.requireNonNull(deadline, "deadline");
    }

    public static SolverRequest of(CostMatrix matrix, Constraints constraints, OptimizeFor optimizeFor, SearchDeadline deadline) {
        return new SolverRequest(matrix, constraints, optimizeFor, deadline);
    }
}
