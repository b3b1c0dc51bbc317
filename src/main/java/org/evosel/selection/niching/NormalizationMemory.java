package org.evosel.selection.niching;

/**
 * Ideal point, worst point and extreme points remembered from earlier generations.
 * <p>
 * Feeding them back into {@link Normalizer#normalize(double[][], NormalizationMemory)} keeps the
 * normalization hyperplane from regressing when a generation loses its extreme individuals.
 * Owned by the caller and carried across generations; not thread-safe.
 */
public final class NormalizationMemory {

    private double[] idealPoint;
    private double[] worstPoint;
    private double[][] extremePoints;

    /**
     * @return {@code true} until the first normalization was remembered.
     */
    public boolean isEmpty() {
        return idealPoint == null;
    }

    /**
     * @return The remembered ideal point, or {@code null}.
     */
    public double[] idealPoint() {
        return idealPoint;
    }

    /**
     * @return The remembered worst point, or {@code null}.
     */
    public double[] worstPoint() {
        return worstPoint;
    }

    /**
     * @return The remembered extreme points, or {@code null}.
     */
    public double[][] extremePoints() {
        return extremePoints;
    }

    /**
     * Stores the reference values of a finished normalization.
     *
     * @param normalization The normalization to remember.
     */
    public void remember(Normalization normalization) {
        this.idealPoint = normalization.idealPoint().clone();
        this.worstPoint = normalization.worstPoint().clone();
        double[][] extremes = new double[normalization.extremePoints().length][];
        for (int i = 0; i < extremes.length; i++) {
            extremes[i] = normalization.extremePoints()[i].clone();
        }
        this.extremePoints = extremes;
    }

    /**
     * Forgets everything, e.g. when the objective functions change between runs.
     */
    public void clear() {
        idealPoint = null;
        worstPoint = null;
        extremePoints = null;
    }
}
