package org.evosel.selection.model;

/**
 * A candidate solution as seen by the selection engine.
 * <p>
 * Only {@link #fitness()} is read during ranking and selection. The decision and strategy vectors
 * belong to the caller's variation operators and are carried through untouched.
 *
 * @param id       Stable key of the individual, unique within a {@link Population}.
 * @param decision The decision vector (may be {@code null}).
 * @param strategy The strategy vector (may be {@code null}).
 * @param fitness  The evaluated fitness.
 */
public record Individual(int id, double[] decision, double[] strategy, Fitness fitness) {

    public Individual {
        if (fitness == null) {
            throw new IllegalArgumentException("Individual " + id + " has no fitness");
        }
    }

    /**
     * Creates an individual that only carries a fitness.
     *
     * @param id      The key.
     * @param fitness The fitness.
     * @return The individual.
     */
    public static Individual of(int id, Fitness fitness) {
        return new Individual(id, null, null, fitness);
    }

    /**
     * Shortcut for an unconstrained individual.
     *
     * @param id         The key.
     * @param objectives The objective values.
     * @return The individual.
     */
    public static Individual of(int id, double... objectives) {
        return new Individual(id, null, null, Fitness.of(objectives));
    }

    /**
     * @return The objective vector of this individual's fitness.
     */
    public double[] objectives() {
        return fitness.objectives();
    }
}
