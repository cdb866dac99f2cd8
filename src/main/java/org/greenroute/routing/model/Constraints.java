package org.greenroute.routing.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional vehicle constraints. A {@code null} field means unconstrained.
 */
@Value
@Builder
public class Constraints {
    private static final Constraints NONE = Constraints.builder().build();

    /** Maximum number of stops the vehicle can serve (one unit of demand per stop). */
    Integer maxCapacity;
    /** Maximum route duration in minutes. */
    Integer maxDurationMinutes;

    /**
     * Returns the shared unconstrained instance.
     */
    public static Constraints none() {
        return NONE;
    }

    public boolean hasCapacityLimit() {
        return maxCapacity != null;
    }

    public boolean hasDurationLimit() {
        return maxDurationMinutes != null;
    }
}
