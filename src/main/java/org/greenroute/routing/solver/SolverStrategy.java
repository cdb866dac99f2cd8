package org.greenroute.routing.solver;

/**
 * Solver implementation selector.
 *
 * <p>{@code SEARCH} runs constraint-aware construction plus local search within the
 * deadline. {@code GREEDY} runs the constraint-unaware nearest-neighbor fallback directly.</p>
 */
public enum SolverStrategy {
    SEARCH,
    GREEDY
}
