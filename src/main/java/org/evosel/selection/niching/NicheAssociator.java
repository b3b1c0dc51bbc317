package org.evosel.selection.niching;

/**
 * Associates individuals with reference directions (Deb and Jain 2014, Algorithm 3).
 * <p>
 * Each objective vector is normalized with the generation's {@link Normalization}, projected on
 * every reference line through the origin, and assigned to the line with the smallest
 * perpendicular distance. Ties go to the lower reference-point index.
 */
public final class NicheAssociator {

    private NicheAssociator() {
        // Utility class - no instantiation
    }

    /**
     * @param fitnesses       Raw objective vectors, N x M.
     * @param referencePoints Reference directions, R x M.
     * @param normalization   The generation's normalization.
     * @return Niche index and distance per individual.
     */
    public static NicheAssignment associate(double[][] fitnesses, double[][] referencePoints, Normalization normalization) {
        return associate(fitnesses, referencePoints, normalization.idealPoint(), normalization.intercepts());
    }

    /**
     * @param fitnesses       Raw objective vectors, N x M.
     * @param referencePoints Reference directions, R x M.
     * @param idealPoint      The ideal point.
     * @param intercepts      Absolute hyperplane intercepts.
     * @return Niche index and distance per individual.
     */
    public static NicheAssignment associate(double[][] fitnesses, double[][] referencePoints,
                                            double[] idealPoint, double[] intercepts) {
        if (referencePoints.length == 0) {
            throw new IllegalArgumentException("At least one reference point is required");
        }
        int m = idealPoint.length;
        double[][] directions = new double[referencePoints.length][];
        for (int r = 0; r < referencePoints.length; r++) {
            if (referencePoints[r].length != m) {
                throw new IllegalArgumentException("Reference point " + r + " has " + referencePoints[r].length
                        + " coordinates, expected " + m);
            }
            directions[r] = unit(referencePoints[r]);
        }

        int[] niches = new int[fitnesses.length];
        double[] distances = new double[fitnesses.length];
        double[] fn = new double[m];
        for (int i = 0; i < fitnesses.length; i++) {
            for (int j = 0; j < m; j++) {
                fn[j] = (fitnesses[i][j] - idealPoint[j]) / (intercepts[j] - idealPoint[j]);
            }
            int bestNiche = 0;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int r = 0; r < directions.length; r++) {
                double d = perpendicularDistance(directions[r], fn);
                if (d < bestDistance) {
                    bestDistance = d;
                    bestNiche = r;
                }
            }
            niches[i] = bestNiche;
            distances[i] = bestDistance;
        }
        return new NicheAssignment(niches, distances);
    }

    /**
     * @param unitDirection A direction of length 1, or all zeros.
     * @param point         A point in normalized objective space.
     * @return Euclidean distance from {@code point} to the line through the origin along the direction.
     */
    static double perpendicularDistance(double[] unitDirection, double[] point) {
        double projection = 0.0;
        for (int j = 0; j < point.length; j++) {
            projection += unitDirection[j] * point[j];
        }
        double sum = 0.0;
        for (int j = 0; j < point.length; j++) {
            double diff = projection * unitDirection[j] - point[j];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static double[] unit(double[] v) {
        double norm = 0.0;
        for (double x : v) {
            norm += x * x;
        }
        norm = Math.sqrt(norm);
        double[] u = new double[v.length];
        if (norm == 0.0) {
            return u;
        }
        for (int j = 0; j < v.length; j++) {
            u[j] = v[j] / norm;
        }
        return u;
    }
}
