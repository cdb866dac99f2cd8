package org.greenroute.routing.matrix;

import org.greenroute.routing.model.OptimizeFor;

import java.util.Objects;

/**
 * Square distance and time matrices over depot (index 0) and stops (1..n-1).
 *
 * <p>Rows are copied on construction and on every array getter, so instances are
 * immutable and safe to share across threads. Hot loops should use
 * {@link #distanceKm(int, int)} and {@link #timeMinutes(int, int)}.</p>
 */
public final class CostMatrix {
    private final double[][] distanceKm;
    private final double[][] timeMinutes;

    private CostMatrix(double[][] distanceKm, double[][] timeMinutes) {
        Objects.requireNonNull(distanceKm, "distanceKm");
        Objects.requireNonNull(timeMinutes, "timeMinutes");
        if (distanceKm.length != timeMinutes.length) {
            throw new IllegalArgumentException(
                    "distance and time matrices differ in size: " + distanceKm.length + " != " + timeMinutes.length
            );
        }
        this.distanceKm = deepCopySquare(distanceKm, "distanceKm");
        this.timeMinutes = deepCopySquare(timeMinutes, "timeMinutes");
    }

    /**
     * Creates a matrix pair from explicit values.
     *
     * @throws IllegalArgumentException when the arrays are not square or differ in size.
     */
    public static CostMatrix of(double[][] distanceKm, double[][] timeMinutes) {
        return new CostMatrix(distanceKm, timeMinutes);
    }

    /**
     * Number of nodes including the depot.
     */
    public int size() {
        return distanceKm.length;
    }

    public double distanceKm(int from, int to) {
        return distanceKm[from][to];
    }

    public double timeMinutes(int from, int to) {
        return timeMinutes[from][to];
    }

    /**
     * Returns a defensive copy of the distance matrix.
     */
    public double[][] distanceMatrix() {
        return deepCopySquare(distanceKm, "distanceKm");
    }

    /**
     * Returns a defensive copy of the time matrix.
     */
    public double[][] timeMatrix() {
        return deepCopySquare(timeMinutes, "timeMinutes");
    }

    /**
     * Returns a defensive copy of the matrix selected by the objective.
     */
    public double[][] activeMatrix(OptimizeFor optimizeFor) {
        return optimizeFor == OptimizeFor.TIME ? timeMatrix() : distanceMatrix();
    }

    private static double[][] deepCopySquare(double[][] source, String name) {
        int n = source.length;
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (source[i] == null || source[i].length != n) {
                throw new IllegalArgumentException(name + " must be square, row " + i + " is malformed");
            }
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
