package org.evosel.selection.sorting;

import org.evosel.selection.dominance.DominanceRelation;

import java.util.Locale;

/**
 * Selects the non-dominated sorting implementation.
 */
public enum SortAlgorithm {

    /** Dominance counting, O(M·N²). */
    NAIVE {
        @Override
        public IFrontAssigner create(boolean constraintsAware) {
            return constraintsAware
                    ? new FeasibilityFirstAssigner(new NaiveFrontAssigner(DominanceRelation.CONSTRAINED))
                    : new NaiveFrontAssigner(DominanceRelation.PLAIN);
        }
    },

    /** Divide-and-conquer with two-objective sweep, O(N log^(M-1) N). */
    FAST {
        @Override
        public IFrontAssigner create(boolean constraintsAware) {
            return constraintsAware
                    ? new FeasibilityFirstAssigner(new FastFrontAssigner())
                    : new FastFrontAssigner();
        }
    };

    /**
     * Creates the assigner for this algorithm.
     *
     * @param constraintsAware Whether constraint violations take precedence over objectives.
     * @return A ready-to-use assigner.
     */
    public abstract IFrontAssigner create(boolean constraintsAware);

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @param value The configured name, e.g. {@code "fast"}.
     * @return The matching algorithm.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static SortAlgorithm fromName(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sort algorithm '" + value + "', expected NAIVE or FAST", e);
        }
    }
}
