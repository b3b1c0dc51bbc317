package org.evosel.selection.model;

import java.util.Arrays;

/**
 * Fitness record of one individual: an ordered vector of objective values (all minimized) and an
 * optional vector of nonnegative constraint violations.
 * <p>
 * The arrays are shared with the caller, not copied. Nothing in this library writes to them.
 *
 * @param objectives  The objective values, never NaN.
 * @param constraints The constraint violations, each {@code >= 0}. Empty means unconstrained.
 */
public record Fitness(double[] objectives, double[] constraints) {

    private static final double[] NO_CONSTRAINTS = new double[0];

    public Fitness {
        if (objectives == null || objectives.length == 0) {
            throw new IllegalArgumentException("Fitness requires at least one objective value");
        }
        for (int i = 0; i < objectives.length; i++) {
            if (Double.isNaN(objectives[i])) {
                throw new IllegalArgumentException("Objective " + i + " is NaN");
            }
        }
        if (constraints == null) {
            constraints = NO_CONSTRAINTS;
        }
        for (int i = 0; i < constraints.length; i++) {
            if (!(constraints[i] >= 0.0)) {
                throw new IllegalArgumentException(
                        "Constraint violation " + i + " must be nonnegative, got: " + constraints[i]);
            }
        }
    }

    /**
     * Creates an unconstrained fitness.
     *
     * @param objectives The objective values.
     * @return A fitness without constraint violations.
     */
    public static Fitness of(double... objectives) {
        return new Fitness(objectives, NO_CONSTRAINTS);
    }

    /**
     * Creates a fitness with constraint violations.
     *
     * @param objectives  The objective values.
     * @param constraints The constraint violations.
     * @return A constrained fitness.
     */
    public static Fitness constrained(double[] objectives, double... constraints) {
        return new Fitness(objectives, constraints);
    }

    /**
     * @return The number of objectives M.
     */
    public int dimension() {
        return objectives.length;
    }

    /**
     * @param index Objective index.
     * @return The objective value at {@code index}.
     */
    public double objective(int index) {
        return objectives[index];
    }

    /**
     * @return The sum of all constraint violations.
     */
    public double totalViolation() {
        double sum = 0.0;
        for (double c : constraints) {
            sum += c;
        }
        return sum;
    }

    /**
     * @return {@code true} if the total violation is exactly zero.
     */
    public boolean isFeasible() {
        return totalViolation() == 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fitness other)) return false;
        return Arrays.equals(objectives, other.objectives) && Arrays.equals(constraints, other.constraints);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(objectives) + Arrays.hashCode(constraints);
    }

    @Override
    public String toString() {
        if (constraints.length == 0) {
            return "Fitness" + Arrays.toString(objectives);
        }
        return "Fitness" + Arrays.toString(objectives) + " violation=" + totalViolation();
    }
}
