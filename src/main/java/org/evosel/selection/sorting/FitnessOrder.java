package org.evosel.selection.sorting;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.evosel.selection.model.Population;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexicographic ordering of objective vectors and grouping of identical fitness values.
 * <p>
 * Comparisons are numeric ({@code <}, {@code >}), never bitwise, so {@code -0.0} and {@code 0.0}
 * fall into the same group. Groups are keyed by population position, never by the floating-point
 * values themselves.
 */
final class FitnessOrder {

    private FitnessOrder() {
        // Utility class - no instantiation
    }

    /**
     * Compares two objective vectors of equal length lexicographically, smaller first.
     *
     * @return A negative number, zero or a positive number.
     */
    static int compare(double[] a, double[] b) {
        for (int i = 0; i < a.length; i++) {
            if (a[i] < b[i]) return -1;
            if (a[i] > b[i]) return 1;
        }
        return 0;
    }

    /**
     * Groups population members that share an identical fitness.
     * <p>
     * The groups come out in ascending lexicographic order of their objective vectors; the members
     * of a group keep population order.
     *
     * @param population  The population.
     * @param byViolation If {@code true}, members must also share the same total violation to be grouped.
     * @return Population positions per group.
     */
    static List<IntArrayList> groupIdentical(Population population, boolean byViolation) {
        int n = population.size();
        double[][] objectives = population.objectiveMatrix();
        double[] violations = new double[n];
        if (byViolation) {
            for (int i = 0; i < n; i++) {
                violations[i] = population.get(i).fitness().totalViolation();
            }
        }

        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        // mergeSort is stable: equal vectors keep population order
        IntArrays.mergeSort(order, (a, b) -> {
            int c = compare(objectives[a], objectives[b]);
            return c != 0 ? c : Double.compare(violations[a], violations[b]);
        });

        List<IntArrayList> groups = new ArrayList<>();
        IntArrayList current = null;
        int previous = -1;
        for (int index : order) {
            if (current == null
                    || compare(objectives[previous], objectives[index]) != 0
                    || violations[previous] != violations[index]) {
                current = new IntArrayList(1);
                groups.add(current);
            }
            current.add(index);
            previous = index;
        }
        return groups;
    }
}
