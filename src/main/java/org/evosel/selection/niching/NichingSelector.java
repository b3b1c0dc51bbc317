package org.evosel.selection.niching;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.evosel.selection.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Niche-preserving selection of NSGA-III (Deb and Jain 2014, Algorithm 4).
 * <p>
 * Fills the remaining slots from the last, partially admitted front. Each round looks at the niches
 * that still have unselected members, takes those with the lowest count (in random order, at most
 * as many as slots remain) and admits one member from each:
 * <ul>
 *   <li>a niche nobody has been committed to yet admits its member closest to the reference line,</li>
 *   <li>any other niche admits a random member.</li>
 * </ul>
 * Every round admits at least one individual, so the number of rounds is bounded by the number of
 * slots. The counts are updated in place.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; owns a {@link Random} drawn from the provider.
 */
public class NichingSelector {

    private static final Logger LOG = LoggerFactory.getLogger(NichingSelector.class);

    private final Random random;

    /**
     * @param randomProvider Source of the tie-break randomness.
     */
    public NichingSelector(IRandomProvider randomProvider) {
        this.random = randomProvider.asJavaRandom();
    }

    /**
     * Selects {@code k} members of the last front.
     *
     * @param k          Number of slots to fill.
     * @param assignment Niche and distance per member of the last front.
     * @param counts     Niche counts of everything already selected; incremented for each admitted member.
     * @return Positions (into {@code assignment}) of the admitted members, in admission order.
     *         Holds {@code min(k, assignment.size())} distinct positions.
     */
    public IntArrayList select(int k, NicheAssignment assignment, NicheCounts counts) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got: " + k);
        }
        int n = assignment.size();
        int[] availableInNiche = new int[counts.size()];
        for (int i = 0; i < n; i++) {
            int niche = assignment.niche(i);
            if (niche < 0 || niche >= counts.size()) {
                throw new IllegalArgumentException("Member " + i + " is associated with niche " + niche
                        + " but only " + counts.size() + " reference points are counted");
            }
            availableInNiche[niche]++;
        }

        int target = k;
        if (k > n) {
            LOG.warn("Requested {} individuals from a front of {}; selecting the whole front", k, n);
            target = n;
        }

        boolean[] taken = new boolean[n];
        IntArrayList selected = new IntArrayList(target);
        while (selected.size() < target) {
            int slots = target - selected.size();

            int minCount = Integer.MAX_VALUE;
            for (int r = 0; r < availableInNiche.length; r++) {
                if (availableInNiche[r] > 0) {
                    minCount = Math.min(minCount, counts.get(r));
                }
            }
            IntArrayList least = new IntArrayList();
            for (int r = 0; r < availableInNiche.length; r++) {
                if (availableInNiche[r] > 0 && counts.get(r) == minCount) {
                    least.add(r);
                }
            }
            int[] niches = IntArrays.shuffle(least.toIntArray(), random);

            for (int i = 0; i < Math.min(slots, niches.length); i++) {
                int niche = niches[i];
                int pick = pickMember(niche, counts.get(niche) == 0, assignment, taken);
                taken[pick] = true;
                availableInNiche[niche]--;
                counts.increment(niche);
                selected.add(pick);
            }
        }
        return selected;
    }

    private int pickMember(int niche, boolean empty, NicheAssignment assignment, boolean[] taken) {
        IntArrayList members = new IntArrayList();
        for (int i = 0; i < assignment.size(); i++) {
            if (!taken[i] && assignment.niche(i) == niche) {
                members.add(i);
            }
        }
        int[] shuffled = IntArrays.shuffle(members.toIntArray(), random);
        if (!empty) {
            return shuffled[0];
        }
        int closest = shuffled[0];
        for (int i = 1; i < shuffled.length; i++) {
            if (assignment.distance(shuffled[i]) < assignment.distance(closest)) {
                closest = shuffled[i];
            }
        }
        return closest;
    }
}
