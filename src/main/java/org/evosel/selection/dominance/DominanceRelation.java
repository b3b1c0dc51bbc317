package org.evosel.selection.dominance;

import org.evosel.selection.model.Fitness;

/**
 * Strict Pareto dominance between two fitness records, all objectives minimized.
 * <p>
 * Both relations are irreflexive and asymmetric. Neither is required to be transitive once ties are
 * involved, which is why the front assigners count dominators pairwise instead of sorting by a total
 * order.
 */
public enum DominanceRelation {

    /**
     * Plain Pareto dominance on the objective vectors. Constraint violations are ignored.
     */
    PLAIN {
        @Override
        public boolean dominates(Fitness a, Fitness b) {
            return DominanceRelation.dominates(a.objectives(), b.objectives());
        }
    },

    /**
     * Constraint-domination (Jain and Deb, 2014):
     * <ul>
     *   <li>a feasible individual dominates an infeasible one,</li>
     *   <li>between two infeasible individuals the lower total violation dominates (equal violation: neither),</li>
     *   <li>between two feasible individuals plain dominance decides.</li>
     * </ul>
     */
    CONSTRAINED {
        @Override
        public boolean dominates(Fitness a, Fitness b) {
            double va = a.totalViolation();
            double vb = b.totalViolation();
            boolean aFeasible = va == 0.0;
            boolean bFeasible = vb == 0.0;
            if (aFeasible && bFeasible) {
                return DominanceRelation.dominates(a.objectives(), b.objectives());
            }
            if (aFeasible) {
                return true;
            }
            if (bFeasible) {
                return false;
            }
            return va < vb;
        }
    };

    /**
     * @param a Candidate dominator.
     * @param b Candidate dominated.
     * @return {@code true} if {@code a} strictly dominates {@code b} under this relation.
     */
    public abstract boolean dominates(Fitness a, Fitness b);

    /**
     * Plain dominance over all objectives.
     *
     * @param a Objective vector of the candidate dominator.
     * @param b Objective vector of the candidate dominated.
     * @return {@code true} if {@code a} is no worse than {@code b} everywhere and better somewhere.
     */
    public static boolean dominates(double[] a, double[] b) {
        return dominates(a, b, a.length - 1);
    }

    /**
     * Plain dominance restricted to objectives {@code 0..lastObjective}.
     *
     * @param a             Objective vector of the candidate dominator.
     * @param b             Objective vector of the candidate dominated.
     * @param lastObjective Highest objective index taken into account.
     * @return {@code true} if {@code a} dominates {@code b} on the leading objectives.
     */
    public static boolean dominates(double[] a, double[] b, int lastObjective) {
        boolean strictlyBetter = false;
        for (int i = 0; i <= lastObjective; i++) {
            if (a[i] > b[i]) {
                return false;
            }
            if (a[i] < b[i]) {
                strictlyBetter = true;
            }
        }
        return strictlyBetter;
    }

    /**
     * Weak dominance restricted to objectives {@code 0..lastObjective}: no worse anywhere, equality allowed.
     *
     * @param a             Objective vector of the candidate dominator.
     * @param b             Objective vector of the candidate dominated.
     * @param lastObjective Highest objective index taken into account.
     * @return {@code true} if {@code a[i] <= b[i]} for every considered objective.
     */
    public static boolean weaklyDominates(double[] a, double[] b, int lastObjective) {
        for (int i = 0; i <= lastObjective; i++) {
            if (a[i] > b[i]) {
                return false;
            }
        }
        return true;
    }
}
