package org.evosel.selection.niching;

import java.util.Arrays;

/**
 * Reference direction chosen for each individual and the perpendicular distance to it.
 *
 * @param niches    Reference-point index per individual.
 * @param distances Perpendicular distance to that reference direction, per individual.
 */
public record NicheAssignment(int[] niches, double[] distances) {

    public NicheAssignment {
        if (niches.length != distances.length) {
            throw new IllegalArgumentException("Got " + niches.length + " niches but " + distances.length + " distances");
        }
    }

    /**
     * @return Number of associated individuals.
     */
    public int size() {
        return niches.length;
    }

    /**
     * @param i Individual position.
     * @return Its reference-point index.
     */
    public int niche(int i) {
        return niches[i];
    }

    /**
     * @param i Individual position.
     * @return Its distance to the reference direction.
     */
    public double distance(int i) {
        return distances[i];
    }

    /**
     * Returns the assignments of the positions {@code from} (inclusive) to {@code to} (exclusive).
     *
     * @param from First position.
     * @param to   Position after the last one.
     * @return A copy of that range.
     */
    public NicheAssignment range(int from, int to) {
        return new NicheAssignment(Arrays.copyOfRange(niches, from, to),
                Arrays.copyOfRange(distances, from, to));
    }
}
