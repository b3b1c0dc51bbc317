package org.evosel.selection.niching;

import java.util.Arrays;

/**
 * Number of already selected individuals per reference point.
 * <p>
 * Owned by the caller: {@link NichingSelector} increments it in place, and the caller decides
 * whether it is reset or carried into the next generation. Not thread-safe.
 */
public final class NicheCounts {

    private final int[] counts;

    /**
     * @param referencePoints Number of reference points R.
     */
    public NicheCounts(int referencePoints) {
        if (referencePoints < 1) {
            throw new IllegalArgumentException("Need at least one reference point, got: " + referencePoints);
        }
        this.counts = new int[referencePoints];
    }

    /**
     * Counts the niches of positions {@code from} (inclusive) to {@code to} (exclusive).
     *
     * @param referencePoints Number of reference points R.
     * @param assignment      Niche assignment of the already selected individuals (and possibly more).
     * @param from            First counted position.
     * @param to              Position after the last counted one.
     * @return A new count table.
     */
    public static NicheCounts of(int referencePoints, NicheAssignment assignment, int from, int to) {
        NicheCounts counts = new NicheCounts(referencePoints);
        for (int i = from; i < to; i++) {
            counts.increment(assignment.niche(i));
        }
        return counts;
    }

    /**
     * @return Number of reference points R.
     */
    public int size() {
        return counts.length;
    }

    /**
     * @param niche Reference-point index.
     * @return Individuals committed to that niche.
     */
    public int get(int niche) {
        return counts[niche];
    }

    /**
     * @param niche Reference-point index.
     */
    public void increment(int niche) {
        counts[niche]++;
    }

    /**
     * Adds another table into this one.
     *
     * @param other A table over the same reference points.
     */
    public void addAll(NicheCounts other) {
        if (other.counts.length != counts.length) {
            throw new IllegalArgumentException("Count tables differ in size: " + counts.length + " vs " + other.counts.length);
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] += other.counts[i];
        }
    }

    /**
     * @return Sum over all niches.
     */
    public int total() {
        int sum = 0;
        for (int c : counts) {
            sum += c;
        }
        return sum;
    }

    /**
     * Sets every count back to zero.
     */
    public void reset() {
        Arrays.fill(counts, 0);
    }

    /**
     * @return A copy of the counts.
     */
    public int[] toArray() {
        return counts.clone();
    }

    @Override
    public String toString() {
        return "NicheCounts" + Arrays.toString(counts);
    }
}
