package org.greenroute.routing.solver;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Arrays;

/**
 * Visiting order over node indices {@code 0..n-1}, depot first.
 *
 * <p>Construction enforces the bijection contract: every index appears exactly once and
 * index {@code 0} leads.</p>
 */
public final class Solution {
    private final int[] order;

    private Solution(int[] order) {
        this.order = order;
    }

    /**
     * Creates a validated solution from a visiting order.
     *
     * @throws IllegalArgumentException when the order is empty, does not start at the depot,
     * or is not a permutation of {@code 0..n-1}.
     */
    public static Solution of(int... order) {
        if (order == null || order.length == 0) {
            throw new IllegalArgumentException("solution order must be non-empty");
        }
        if (order[0] != 0) {
            throw new IllegalArgumentException("solution must start at depot 0, got " + order[0]);
        }
        boolean[] seen = new boolean[order.length];
        for (int node : order) {
            if (node < 0 || node >= order.length) {
                throw new IllegalArgumentException("node index out of range: " + node + " for size " + order.length);
            }
            if (seen[node]) {
                throw new IllegalArgumentException("node index repeated: " + node);
            }
            seen[node] = true;
        }
        return new Solution(order.clone());
    }

    public int size() {
        return order.length;
    }

    public int nodeAt(int position) {
        return order[position];
    }

    /**
     * Returns a copy of the visiting order.
     */
    public int[] toArray() {
        return order.clone();
    }

    /**
     * Returns an unmodifiable primitive-list view of the visiting order.
     */
    public IntList asList() {
        return IntLists.unmodifiable(IntArrayList.wrap(order.clone()));
    }

    /**
     * Sums consecutive edge costs along the order on the given matrix. No return leg.
     */
    public double pathCost(double[][] matrix) {
        double total = 0.0d;
        for (int i = 1; i < order.length; i++) {
            total += matrix[order[i - 1]][order[i]];
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Solution other)) {
            return false;
        }
        return Arrays.equals(order, other.order);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(order);
    }

    @Override
    public String toString() {
        return "Solution" + Arrays.toString(order);
    }
}
