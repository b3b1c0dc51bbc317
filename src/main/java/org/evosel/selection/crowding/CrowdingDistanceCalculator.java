package org.evosel.selection.crowding;

import it.unimi.dsi.fastutil.ints.Int2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.evosel.selection.model.Individual;

import java.util.List;

/**
 * Crowding distance of NSGA-II (Deb et al. 2002).
 * <p>
 * Per objective the members are ordered by value (stable, so ties keep their input order); the
 * first and last member become unbounded and every interior member accumulates the normalized gap
 * between its neighbours, {@code (next - prev) / (M * (max - min))}. An objective on which all
 * members agree is skipped and contributes nothing, including to its boundaries.
 */
public final class CrowdingDistanceCalculator {

    private CrowdingDistanceCalculator() {
        // Utility class - no instantiation
    }

    /**
     * @param members Members of one front.
     * @return Distance per individual id, in input order. Larger means less crowded.
     */
    public static Int2DoubleMap calculate(List<Individual> members) {
        Int2DoubleLinkedOpenHashMap result = new Int2DoubleLinkedOpenHashMap(members.size());
        if (members.isEmpty()) {
            return result;
        }
        int n = members.size();
        int m = members.get(0).fitness().dimension();
        double[][] values = new double[n][];
        for (int i = 0; i < n; i++) {
            values[i] = members.get(i).objectives();
            if (values[i].length != m) {
                throw new IllegalArgumentException("Individual " + members.get(i).id() + " has " + values[i].length
                        + " objectives, expected " + m);
            }
        }

        double[] distances = distances(values);
        for (int i = 0; i < n; i++) {
            int id = members.get(i).id();
            if (result.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate individual id: " + id);
            }
            result.put(id, distances[i]);
        }
        return result;
    }

    /**
     * @param values Objective vectors, N x M, all of the same length.
     * @return Distance per row.
     */
    public static double[] distances(double[][] values) {
        int n = values.length;
        double[] distances = new double[n];
        if (n == 0) {
            return distances;
        }
        int m = values[0].length;
        int[] order = new int[n];
        for (int axis = 0; axis < m; axis++) {
            for (int i = 0; i < n; i++) {
                order[i] = i;
            }
            final int j = axis;
            IntArrays.mergeSort(order, (a, b) -> Double.compare(values[a][j], values[b][j]));

            double min = values[order[0]][j];
            double max = values[order[n - 1]][j];
            if (min == max) {
                // a flat axis contributes nothing, its boundary members included
                continue;
            }
            distances[order[0]] = Double.POSITIVE_INFINITY;
            distances[order[n - 1]] = Double.POSITIVE_INFINITY;
            double norm = m * (max - min);
            if (!Double.isFinite(norm)) {
                continue;
            }
            for (int i = 1; i < n - 1; i++) {
                distances[order[i]] += (values[order[i + 1]][j] - values[order[i - 1]][j]) / norm;
            }
        }
        return distances;
    }
}
