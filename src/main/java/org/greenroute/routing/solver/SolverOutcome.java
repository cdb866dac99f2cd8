package org.greenroute.routing.solver;

import lombok.Builder;
import lombok.Value;
import org.greenroute.routing.model.OptimizationQuality;

/**
 * Result of one solver run.
 */
@Value
@Builder
public class SolverOutcome {
    /** Returned visiting order. */
    Solution solution;
    /** Whether constraints were verified for {@link #solution}. */
    OptimizationQuality quality;
    /** True when the search finished inside the deadline. */
    boolean converged;
    /** Objective value of {@link #solution} on the active matrix. */
    double objectiveCost;
    /** Strategy that produced the outcome. */
    SolverStrategy strategy;
}
