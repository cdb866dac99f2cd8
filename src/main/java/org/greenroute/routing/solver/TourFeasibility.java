package org.greenroute.routing.solver;

import org.greenroute.routing.matrix.CostMatrix;
import org.greenroute.routing.model.Constraints;

/**
 * Capacity and duration checks over partial and complete tours.
 *
 * <p>Demand is 0 at the depot and 1 at every stop. Duration accumulates time-matrix transit
 * only, and is violated once it exceeds the limit by more than {@link #WAITING_SLACK_MINUTES}.</p>
 */
final class TourFeasibility {
    static final int WAITING_SLACK_MINUTES = 30;

    private final CostMatrix matrix;
    private final int capacity;
    private final double durationLimit;

    TourFeasibility(CostMatrix matrix, Constraints constraints) {
        this.matrix = matrix;
        this.capacity = constraints.hasCapacityLimit() ? constraints.getMaxCapacity() : Integer.MAX_VALUE;
        this.durationLimit = constraints.hasDurationLimit()
                ? constraints.getMaxDurationMinutes() + (double) WAITING_SLACK_MINUTES
                : Double.POSITIVE_INFINITY;
    }

    static int demandOf(int node) {
        return node == 0 ? 0 : 1;
    }

    boolean admitsLoad(int load) {
        return load <= capacity;
    }

    boolean admitsDuration(double duration) {
        return duration <= durationLimit;
    }

    double extendDuration(double duration, int from, int to) {
        return duration + matrix.timeMinutes(from, to);
    }

    /**
     * Whether reordering a complete tour can change feasibility.
     *
     * <p>Load along a complete tour only depends on position, so only a duration limit
     * makes feasibility order-sensitive.</p>
     */
    boolean isOrderSensitive() {
        return Double.isFinite(durationLimit);
    }

    /**
     * Checks every prefix of a tour against capacity and duration.
     */
    boolean isFeasible(int[] tour) {
        int load = 0;
        double duration = 0.0d;
        for (int i = 1; i < tour.length; i++) {
            load += demandOf(tour[i]);
            if (!admitsLoad(load)) {
                return false;
            }
            duration = extendDuration(duration, tour[i - 1], tour[i]);
            if (!admitsDuration(duration)) {
                return false;
            }
        }
        return true;
    }
}
