package org.greenroute.routing.solver;

/**
 * Visiting-order solver abstraction.
 *
 * <p>Implementations are stateless and safe to share across threads.</p>
 */
public interface ConstraintSolver {
    /**
     * Computes a visiting order for the request.
     *
     * @param request normalized solver input.
     * @return outcome with solution and quality flag.
     * @throws SolverNonConvergenceException when no feasible incumbent can be produced.
     */
    SolverOutcome solve(SolverRequest request);

    /**
     * Strategy implemented by this solver.
     */
    SolverStrategy strategy();
}
