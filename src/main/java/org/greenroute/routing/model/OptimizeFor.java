package org.greenroute.routing.model;

/**
 * Objective selector.
 *
 * <p>{@code TIME} drives the solver with the traffic/weather adjusted time matrix,
 * {@code DISTANCE} with the great-circle distance matrix.</p>
 */
public enum OptimizeFor {
    TIME,
    DISTANCE
}
