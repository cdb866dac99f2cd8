package org.greenroute.routing.model;

/**
 * Quality flag attached to every optimization result.
 *
 * <p>{@code OPTIMAL} marks a tour produced by the constraint-aware solver, so capacity and
 * duration limits were verified. {@code HEURISTIC_FALLBACK} marks a nearest-neighbor tour
 * for which constraints were not checked.</p>
 */
public enum OptimizationQuality {
    OPTIMAL("optimal"),
    HEURISTIC_FALLBACK("heuristic_fallback");

    private final String wireName;

    OptimizationQuality(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lower-snake-case name used in serialized results.
     */
    public String wireName() {
        return wireName;
    }
}
