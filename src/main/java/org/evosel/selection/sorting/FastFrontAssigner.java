package org.evosel.selection.sorting;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.evosel.selection.dominance.DominanceRelation;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Divide-and-conquer non-dominated sort (Jensen 2003, generalized by Fortin, Grenier and Parizeau 2013).
 * <p>
 * Works on the distinct fitness values only, sorted lexicographically ascending, so that a value can
 * only be dominated by values that precede it. The recursion walks the objectives from the last one
 * down to the second:
 * <ul>
 *   <li>{@code sortA} ranks a set against itself. It splits the set at the median of the current
 *       objective, ranks the better half, lets the better half push ranks into the worse half
 *       ({@code sortB}), then ranks the worse half.</li>
 *   <li>{@code sortB} propagates ranks from a fully ranked set into another set whose members are
 *       already known to be worse on every objective above the current one.</li>
 *   <li>Two objectives left: both procedures fall through to a sweep over a staircase of
 *       second-objective values, O(N log N) per call.</li>
 * </ul>
 * O(N log^(M-1) N) overall. Produces the same partition as {@link NaiveFrontAssigner}.
 */
public class FastFrontAssigner implements IFrontAssigner {

    private static final Logger LOG = LoggerFactory.getLogger(FastFrontAssigner.class);

    /** {@inheritDoc} */
    @Override
    public FrontRanking assign(Population population, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got: " + k);
        }
        if (k == 0 || population.isEmpty()) {
            return FrontRanking.empty();
        }

        List<IntArrayList> groups = FitnessOrder.groupIdentical(population, false);
        int g = groups.size();
        double[][] fits = new double[g][];
        for (int i = 0; i < g; i++) {
            fits[i] = population.get(groups.get(i).getInt(0)).objectives();
        }

        int[] rank = new int[g];
        int m = population.objectiveCount();
        if (m == 1) {
            // distinct values in ascending order, each one dominates all that follow
            for (int i = 0; i < g; i++) {
                rank[i] = i;
            }
        } else if (g > 1) {
            int[] all = new int[g];
            for (int i = 0; i < g; i++) {
                all[i] = i;
            }
            new RankPropagation(fits, rank).sortA(all, m - 1);
        }

        int frontCount = 0;
        for (int r : rank) {
            frontCount = Math.max(frontCount, r + 1);
        }
        List<IntArrayList> fronts = new ArrayList<>(frontCount);
        for (int i = 0; i < frontCount; i++) {
            fronts.add(new IntArrayList());
        }
        for (int i = 0; i < g; i++) {
            IntArrayList front = fronts.get(rank[i]);
            for (int index : groups.get(i)) {
                front.add(population.get(index).id());
            }
        }

        LOG.debug("Fast sort ranked {} individuals ({} distinct fitness values) into {} fronts",
                population.size(), g, frontCount);
        return FrontRanking.of(fronts, false).truncate(k);
    }

    /**
     * Recursion state for one sort call: the distinct fitness values in lexicographic order and their
     * ranks. Index sets are passed as ascending {@code int[]} positions into {@code fits}, so every
     * subset stays lexicographically sorted.
     */
    private static final class RankPropagation {

        private final double[][] fits;
        private final int[] rank;

        RankPropagation(double[][] fits, int[] rank) {
            this.fits = fits;
            this.rank = rank;
        }

        /**
         * Ranks the members of {@code s} against each other on objectives {@code 0..obj}.
         */
        void sortA(int[] s, int obj) {
            if (s.length < 2) {
                return;
            }
            if (s.length == 2) {
                if (DominanceRelation.dominates(fits[s[0]], fits[s[1]], obj)) {
                    raise(s[1], s[0]);
                }
                return;
            }
            if (obj == 1) {
                sweepA(s);
                return;
            }
            if (allEqual(s, obj)) {
                // objective carries no information for this subset
                sortA(s, obj - 1);
                return;
            }
            int[][] split = splitA(s, obj);
            sortA(split[0], obj);
            sortB(split[0], split[1], obj - 1);
            sortA(split[1], obj);
        }

        /**
         * Raises the ranks of {@code worst} according to the final ranks of {@code best}. Every member of
         * {@code best} is strictly better than every member of {@code worst} on some objective above
         * {@code obj} and no worse on the others above it.
         */
        void sortB(int[] best, int[] worst, int obj) {
            if (best.length == 0 || worst.length == 0) {
                return;
            }
            if (best.length == 1 || worst.length == 1) {
                for (int h : worst) {
                    for (int l : best) {
                        if (DominanceRelation.weaklyDominates(fits[l], fits[h], obj)) {
                            raise(h, l);
                        }
                    }
                }
                return;
            }
            if (obj == 1) {
                sweepB(best, worst);
                return;
            }

            double bestMin = Double.POSITIVE_INFINITY;
            double bestMax = Double.NEGATIVE_INFINITY;
            for (int l : best) {
                bestMin = Math.min(bestMin, fits[l][obj]);
                bestMax = Math.max(bestMax, fits[l][obj]);
            }
            double worstMin = Double.POSITIVE_INFINITY;
            double worstMax = Double.NEGATIVE_INFINITY;
            for (int h : worst) {
                worstMin = Math.min(worstMin, fits[h][obj]);
                worstMax = Math.max(worstMax, fits[h][obj]);
            }

            if (bestMax <= worstMin) {
                // best is no worse than worst on this objective: decided by the lower ones
                sortB(best, worst, obj - 1);
            } else if (bestMin <= worstMax) {
                int[][] split = splitB(best, worst, obj);
                sortB(split[0], split[2], obj);
                sortB(split[0], split[3], obj - 1);
                sortB(split[1], split[3], obj);
            }
            // otherwise every member of best is worse than every member of worst here: nothing to do
        }

        /**
         * Two-objective sweep over a lexicographically sorted set.
         */
        private void sweepA(int[] s) {
            Staircase stairs = new Staircase();
            stairs.insert(0, s[0], fits[s[0]][1]);
            for (int t = 1; t < s.length; t++) {
                int fit = s[t];
                double value = fits[fit][1];
                int idx = stairs.upperBound(value);
                if (idx > 0) {
                    rank[fit] = Math.max(rank[fit], stairs.maxRank(idx) + 1);
                }
                for (int i = idx; i < stairs.size(); i++) {
                    if (rank[stairs.member(i)] == rank[fit]) {
                        stairs.remove(i);
                        break;
                    }
                }
                stairs.insert(idx, fit, value);
            }
        }

        /**
         * Two-objective sweep propagating ranks from {@code best} into {@code worst}.
         */
        private void sweepB(int[] best, int[] worst) {
            Staircase stairs = new Staircase();
            int next = 0;
            for (int h : worst) {
                double[] fh = fits[h];
                while (next < best.length && leadingPairNotAfter(fits[best[next]], fh)) {
                    int b = best[next];
                    boolean insert = true;
                    for (int i = 0; i < stairs.size(); i++) {
                        int stair = stairs.member(i);
                        if (rank[stair] == rank[b]) {
                            if (fits[stair][1] < fits[b][1]) {
                                insert = false;
                            } else {
                                stairs.remove(i);
                            }
                            break;
                        }
                    }
                    if (insert) {
                        stairs.insert(stairs.upperBound(fits[b][1]), b, fits[b][1]);
                    }
                    next++;
                }
                int idx = stairs.upperBound(fh[1]);
                if (idx > 0) {
                    rank[h] = Math.max(rank[h], stairs.maxRank(idx) + 1);
                }
            }
        }

        /**
         * Splits at the median of {@code obj}; values equal to the median join whichever side keeps the
         * halves closer in size.
         *
         * @return {@code {best, worst}}
         */
        private int[][] splitA(int[] s, int obj) {
            double median = median(s, obj);
            IntArrayList bestA = new IntArrayList();
            IntArrayList worstA = new IntArrayList();
            IntArrayList bestB = new IntArrayList();
            IntArrayList worstB = new IntArrayList();
            for (int i : s) {
                double v = fits[i][obj];
                if (v < median) {
                    bestA.add(i);
                    bestB.add(i);
                } else if (v > median) {
                    worstA.add(i);
                    worstB.add(i);
                } else {
                    bestA.add(i);
                    worstB.add(i);
                }
            }
            int balanceA = Math.abs(bestA.size() - worstA.size());
            int balanceB = Math.abs(bestB.size() - worstB.size());
            return balanceA <= balanceB
                    ? new int[][]{bestA.toIntArray(), worstA.toIntArray()}
                    : new int[][]{bestB.toIntArray(), worstB.toIntArray()};
        }

        /**
         * Splits both sets at the median of {@code obj} taken over the larger one.
         *
         * @return {@code {best1, best2, worst1, worst2}}, the "1" parts being the better halves.
         */
        private int[][] splitB(int[] best, int[] worst, int obj) {
            double median = median(best.length > worst.length ? best : worst, obj);
            IntArrayList[] bestA = halves(best, obj, median, true);
            IntArrayList[] bestB = halves(best, obj, median, false);
            IntArrayList[] worstA = halves(worst, obj, median, true);
            IntArrayList[] worstB = halves(worst, obj, median, false);

            int balanceA = Math.abs(bestA[0].size() - bestA[1].size() + worstA[0].size() - worstA[1].size());
            int balanceB = Math.abs(bestB[0].size() - bestB[1].size() + worstB[0].size() - worstB[1].size());
            if (balanceA <= balanceB) {
                return new int[][]{bestA[0].toIntArray(), bestA[1].toIntArray(),
                        worstA[0].toIntArray(), worstA[1].toIntArray()};
            }
            return new int[][]{bestB[0].toIntArray(), bestB[1].toIntArray(),
                    worstB[0].toIntArray(), worstB[1].toIntArray()};
        }

        private IntArrayList[] halves(int[] s, int obj, double median, boolean tiesToBetter) {
            IntArrayList better = new IntArrayList();
            IntArrayList worse = new IntArrayList();
            for (int i : s) {
                double v = fits[i][obj];
                if (v < median || (v == median && tiesToBetter)) {
                    better.add(i);
                } else {
                    worse.add(i);
                }
            }
            return new IntArrayList[]{better, worse};
        }

        private double median(int[] s, int obj) {
            double[] values = new double[s.length];
            for (int i = 0; i < s.length; i++) {
                values[i] = fits[s[i]][obj];
            }
            Arrays.sort(values);
            int n = values.length;
            if (n % 2 == 1) {
                return values[(n - 1) / 2];
            }
            double lower = values[(n - 1) / 2];
            double upper = values[n / 2];
            // halves first: the sum overflows near Double.MAX_VALUE; -inf/+inf has no midpoint
            double mid = lower / 2.0 + upper / 2.0;
            return Double.isNaN(mid) ? lower : mid;
        }

        private boolean allEqual(int[] s, int obj) {
            double first = fits[s[0]][obj];
            for (int i = 1; i < s.length; i++) {
                if (fits[s[i]][obj] != first) {
                    return false;
                }
            }
            return true;
        }

        private void raise(int dominated, int dominator) {
            rank[dominated] = Math.max(rank[dominated], rank[dominator] + 1);
        }

        private static boolean leadingPairNotAfter(double[] a, double[] b) {
            return a[0] < b[0] || (a[0] == b[0] && a[1] <= b[1]);
        }

        /**
         * Members ordered by ascending second-objective value, binary-searchable by that value.
         */
        private final class Staircase {

            private final IntArrayList members = new IntArrayList();
            private final DoubleArrayList values = new DoubleArrayList();

            int size() {
                return members.size();
            }

            int member(int i) {
                return members.getInt(i);
            }

            /**
             * @return The number of stairs whose value is {@code <= value}.
             */
            int upperBound(double value) {
                int lo = 0;
                int hi = values.size();
                while (lo < hi) {
                    int mid = (lo + hi) >>> 1;
                    if (values.getDouble(mid) <= value) {
                        lo = mid + 1;
                    } else {
                        hi = mid;
                    }
                }
                return lo;
            }

            /**
             * @return The highest rank among the first {@code count} stairs.
             */
            int maxRank(int count) {
                int max = rank[members.getInt(0)];
                for (int i = 1; i < count; i++) {
                    max = Math.max(max, rank[members.getInt(i)]);
                }
                return max;
            }

            void insert(int idx, int member, double value) {
                members.add(idx, member);
                values.add(idx, value);
            }

            void remove(int idx) {
                members.removeInt(idx);
                values.removeDouble(idx);
            }
        }
    }
}
