package org.evosel.selection.niching;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates reference directions on the unit simplex {@code sum(x) = 1} (Das and Dennis lattice).
 * <p>
 * With {@code p} divisions every coordinate is a multiple of {@code 1/p}, giving
 * {@code C(p+M-1, M-1)} points for M objectives. For many objectives a single lattice either has
 * too few interior points or too many points overall; several smaller lattices shrunk toward the
 * centroid can be layered instead (Deb and Jain 2014, Fig. 4).
 */
public final class ReferencePointGenerator {

    private ReferencePointGenerator() {
        // Utility class - no instantiation
    }

    /**
     * @param objectives Number of objectives M, {@code >= 1}.
     * @param divisions  Number of divisions p along each axis, {@code >= 1}.
     * @return The lattice points, each of length M.
     */
    public static double[][] uniform(int objectives, int divisions) {
        return uniform(objectives, divisions, 1.0);
    }

    /**
     * Generates the lattice and shrinks it toward the centroid:
     * {@code x' = x * scaling + (1 - scaling) / M}. The result still sums to 1.
     *
     * @param objectives Number of objectives M, {@code >= 1}.
     * @param divisions  Number of divisions p along each axis, {@code >= 1}.
     * @param scaling    Shrink factor, 1.0 leaves the lattice unchanged.
     * @return The scaled lattice points.
     */
    public static double[][] uniform(int objectives, int divisions, double scaling) {
        if (objectives < 1) {
            throw new IllegalArgumentException("objectives must be >= 1, got: " + objectives);
        }
        if (divisions < 1) {
            throw new IllegalArgumentException("divisions must be >= 1, got: " + divisions);
        }
        if (!(scaling > 0.0 && scaling <= 1.0)) {
            throw new IllegalArgumentException("scaling must be in (0, 1], got: " + scaling);
        }
        List<double[]> points = new ArrayList<>();
        compose(points, new double[objectives], divisions, divisions, 0);
        if (scaling != 1.0) {
            double shift = (1.0 - scaling) / objectives;
            for (double[] point : points) {
                for (int i = 0; i < point.length; i++) {
                    point[i] = point[i] * scaling + shift;
                }
            }
        }
        return points.toArray(new double[0][]);
    }

    /**
     * Concatenates several lattices, layer {@code i} using {@code divisions[i]} and {@code scalings[i]}.
     *
     * @param objectives Number of objectives M.
     * @param divisions  Divisions per layer.
     * @param scalings   Scaling per layer, same length as {@code divisions}.
     * @return All layers' points, outermost layer first if given first.
     */
    public static double[][] layered(int objectives, int[] divisions, double[] scalings) {
        if (divisions.length == 0 || divisions.length != scalings.length) {
            throw new IllegalArgumentException("Need one scaling per layer, got " + divisions.length
                    + " division counts and " + scalings.length + " scalings");
        }
        List<double[]> all = new ArrayList<>();
        for (int layer = 0; layer < divisions.length; layer++) {
            all.addAll(List.of(uniform(objectives, divisions[layer], scalings[layer])));
        }
        return all.toArray(new double[0][]);
    }

    /**
     * Enumerates all compositions of {@code left} into the coordinates {@code depth..M-1}.
     */
    private static void compose(List<double[]> points, double[] prefix, int left, int total, int depth) {
        if (depth == prefix.length - 1) {
            double[] point = prefix.clone();
            point[depth] = (double) left / total;
            points.add(point);
            return;
        }
        for (int i = 0; i <= left; i++) {
            prefix[depth] = (double) i / total;
            compose(points, prefix, left - i, total, depth + 1);
        }
    }
}
