package org.evosel.selection.niching;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Adaptive normalization of NSGA-III (Deb and Jain 2014, Algorithm 2).
 * <p>
 * Translates the objectives by the ideal point, picks one extreme point per axis with an
 * achievement scalarizing function, and fits the hyperplane through the extreme points. Where the
 * hyperplane cannot be trusted the worst observed values are used as intercepts instead. Every
 * axis ends up with a span strictly greater than {@link #MIN_SPAN}.
 */
public final class Normalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    /** Smallest accepted distance between ideal point and intercept on any axis. */
    public static final double MIN_SPAN = 1e-6;

    /** Weight of the off-axis objectives in the achievement scalarizing function. */
    static final double OFF_AXIS_WEIGHT = 1e6;

    private static final double ZERO_SOLUTION = 1e-12;
    private static final double RESIDUAL_ABS_TOLERANCE = 1e-8;
    private static final double RESIDUAL_REL_TOLERANCE = 1e-5;

    private Normalizer() {
        // Utility class - no instantiation
    }

    /**
     * Runs the full normalization over the given candidates.
     * <p>
     * With a memory, the ideal and worst points also account for earlier generations and the
     * previous extreme points compete with the current candidates. The memory is updated with the
     * result.
     *
     * @param fitnesses Objective vectors of all ranked candidates.
     * @param memory    Values carried across generations, or {@code null} to use the current candidates only.
     * @return The normalization.
     */
    public static Normalization normalize(double[][] fitnesses, NormalizationMemory memory) {
        if (fitnesses.length == 0) {
            throw new IllegalArgumentException("Cannot normalize an empty candidate set");
        }
        boolean remembered = memory != null && !memory.isEmpty();

        double[] frontWorst = worstPoint(fitnesses);
        double[] ideal = idealPoint(fitnesses);
        double[] worst = frontWorst.clone();
        double[][] previousExtremes = null;
        if (remembered) {
            checkDimension(memory.idealPoint(), ideal.length, "remembered ideal point");
            for (int j = 0; j < ideal.length; j++) {
                ideal[j] = Math.min(ideal[j], memory.idealPoint()[j]);
                worst[j] = Math.max(worst[j], memory.worstPoint()[j]);
            }
            previousExtremes = memory.extremePoints();
        }

        double[][] extremes = extremePoints(fitnesses, ideal, previousExtremes);
        double[] intercepts = intercepts(extremes, ideal, worst, frontWorst);
        Normalization normalization = new Normalization(ideal, worst, extremes, intercepts);
        if (memory != null) {
            memory.remember(normalization);
        }
        return normalization;
    }

    /**
     * @param fitnesses Objective vectors.
     * @return The component-wise minimum.
     */
    public static double[] idealPoint(double[][] fitnesses) {
        double[] ideal = fitnesses[0].clone();
        for (double[] f : fitnesses) {
            for (int j = 0; j < ideal.length; j++) {
                ideal[j] = Math.min(ideal[j], f[j]);
            }
        }
        return ideal;
    }

    /**
     * @param fitnesses Objective vectors.
     * @return The component-wise maximum.
     */
    public static double[] worstPoint(double[][] fitnesses) {
        double[] worst = fitnesses[0].clone();
        for (double[] f : fitnesses) {
            for (int j = 0; j < worst.length; j++) {
                worst[j] = Math.max(worst[j], f[j]);
            }
        }
        return worst;
    }

    /**
     * Finds, for each axis {@code j}, the candidate minimizing
     * {@code max_i (f_i - ideal_i) * w_i} with {@code w_j = 1} and all other weights
     * {@link #OFF_AXIS_WEIGHT}. Ties go to the first candidate.
     *
     * @param fitnesses        Objective vectors of the current candidates.
     * @param ideal            The ideal point.
     * @param previousExtremes Extreme points of the previous generation appended as extra candidates, or {@code null}.
     * @return M extreme points, row {@code j} for axis {@code j} (copies).
     */
    public static double[][] extremePoints(double[][] fitnesses, double[] ideal, double[][] previousExtremes) {
        int m = ideal.length;
        double[][] candidates = fitnesses;
        if (previousExtremes != null) {
            candidates = Arrays.copyOf(fitnesses, fitnesses.length + previousExtremes.length);
            System.arraycopy(previousExtremes, 0, candidates, fitnesses.length, previousExtremes.length);
        }

        double[][] extremes = new double[m][];
        for (int axis = 0; axis < m; axis++) {
            int best = 0;
            double bestAsf = Double.POSITIVE_INFINITY;
            for (int c = 0; c < candidates.length; c++) {
                double[] f = candidates[c];
                double asf = Double.NEGATIVE_INFINITY;
                for (int i = 0; i < m; i++) {
                    double weight = i == axis ? 1.0 : OFF_AXIS_WEIGHT;
                    asf = Math.max(asf, (f[i] - ideal[i]) * weight);
                }
                if (asf < bestAsf) {
                    bestAsf = asf;
                    best = c;
                }
            }
            extremes[axis] = candidates[best].clone();
        }
        return extremes;
    }

    /**
     * Computes the hyperplane intercepts, solving {@code (extremes - ideal) x = 1} so that the
     * intercept on axis {@code j} lies at {@code ideal_j + 1 / x_j}.
     * <p>
     * Fallbacks, in order:
     * <ol>
     *   <li>singular system: {@code currentWorst};</li>
     *   <li>a zero solution component: {@code frontWorst};</li>
     *   <li>failed reconstruction, a span {@code <= MIN_SPAN}, or an intercept beyond
     *       {@code currentWorst}: {@code frontWorst};</li>
     *   <li>any axis still not wider than {@code MIN_SPAN} (all candidates equal on it): unit span.</li>
     * </ol>
     *
     * @param extremes     Extreme points, one row per axis.
     * @param ideal        The ideal point.
     * @param currentWorst Worst values known so far, including memory.
     * @param frontWorst   Worst values among the current candidates.
     * @return Absolute intercepts, one per axis.
     */
    public static double[] intercepts(double[][] extremes, double[] ideal, double[] currentWorst, double[] frontWorst) {
        int m = ideal.length;
        double[][] a = new double[m][m];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < m; j++) {
                a[i][j] = extremes[i][j] - ideal[j];
            }
        }
        RealVector b = new ArrayRealVector(m, 1.0);

        double[] intercepts;
        String fallback = null;
        try {
            Array2DRowRealMatrix matrix = new Array2DRowRealMatrix(a, false);
            RealVector x = new LUDecomposition(matrix).getSolver().solve(b);
            intercepts = hyperplaneIntercepts(matrix, x, b, ideal, currentWorst);
            if (intercepts == null) {
                fallback = "front worst";
                intercepts = frontWorst.clone();
            }
        } catch (SingularMatrixException e) {
            fallback = "current worst (singular extreme points)";
            intercepts = currentWorst.clone();
        }
        if (fallback != null) {
            LOG.debug("Hyperplane rejected, using {} as intercepts: {}", fallback, Arrays.toString(intercepts));
        }

        for (int j = 0; j < m; j++) {
            if (!(intercepts[j] - ideal[j] > MIN_SPAN)) {
                LOG.debug("Objective {} has no spread above the ideal point {}, using unit span", j, ideal[j]);
                intercepts[j] = ideal[j] + 1.0;
            }
        }
        return intercepts;
    }

    /**
     * @return The absolute intercepts, or {@code null} if the solution must be rejected.
     */
    private static double[] hyperplaneIntercepts(Array2DRowRealMatrix matrix, RealVector x, RealVector b,
                                                 double[] ideal, double[] currentWorst) {
        int m = ideal.length;
        for (int j = 0; j < m; j++) {
            double xj = x.getEntry(j);
            if (Math.abs(xj) < ZERO_SOLUTION || !Double.isFinite(xj)) {
                return null;
            }
        }
        RealVector reconstructed = matrix.operate(x);
        double[] intercepts = new double[m];
        for (int j = 0; j < m; j++) {
            double residual = Math.abs(reconstructed.getEntry(j) - b.getEntry(j));
            if (residual > RESIDUAL_ABS_TOLERANCE + RESIDUAL_REL_TOLERANCE * Math.abs(b.getEntry(j))) {
                return null;
            }
            double span = 1.0 / x.getEntry(j);
            if (span <= MIN_SPAN) {
                return null;
            }
            intercepts[j] = ideal[j] + span;
            if (intercepts[j] > currentWorst[j]) {
                return null;
            }
        }
        return intercepts;
    }

    private static void checkDimension(double[] vector, int expected, String what) {
        if (vector.length != expected) {
            throw new IllegalArgumentException(what + " has " + vector.length + " objectives, expected " + expected);
        }
    }
}
