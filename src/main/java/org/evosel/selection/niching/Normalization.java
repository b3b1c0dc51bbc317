package org.evosel.selection.niching;

/**
 * Hyperplane normalization of one generation.
 *
 * @param idealPoint    Component-wise best (minimum) objective values.
 * @param worstPoint    Component-wise worst (maximum) objective values.
 * @param extremePoints One extreme point per objective axis, row {@code j} belonging to axis {@code j}.
 * @param intercepts    Absolute objective value where the fitted hyperplane crosses each axis.
 */
public record Normalization(double[] idealPoint, double[] worstPoint, double[][] extremePoints, double[] intercepts) {

    /**
     * @return Number of objectives.
     */
    public int dimension() {
        return idealPoint.length;
    }

    /**
     * Distance from the ideal point to the intercept on axis {@code j}; always greater than
     * {@link Normalizer#MIN_SPAN}.
     *
     * @param j Objective axis.
     * @return The normalization denominator for that axis.
     */
    public double span(int j) {
        return intercepts[j] - idealPoint[j];
    }

    /**
     * Maps objective values into the normalized space: {@code (f - ideal) / (intercept - ideal)}.
     *
     * @param objectives Raw objective values.
     * @return A new normalized vector.
     */
    public double[] normalize(double[] objectives) {
        double[] normalized = new double[objectives.length];
        for (int j = 0; j < objectives.length; j++) {
            normalized[j] = (objectives[j] - idealPoint[j]) / span(j);
        }
        return normalized;
    }
}
