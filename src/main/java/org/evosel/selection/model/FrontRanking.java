package org.evosel.selection.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a front assignment: ordered fronts covering at least the requested number of
 * individuals (or every individual when fewer exist).
 *
 * @param fronts        The fronts in nondecreasing dominance depth.
 * @param allInfeasible {@code true} if a constraint-aware sort found no feasible individual and
 *                      returned the two-tier violation ranking instead of dominance fronts.
 */
public record FrontRanking(List<Front> fronts, boolean allInfeasible) {

    private static final FrontRanking EMPTY = new FrontRanking(List.of(), false);

    public FrontRanking {
        fronts = List.copyOf(fronts);
    }

    /**
     * @return A ranking without fronts.
     */
    public static FrontRanking empty() {
        return EMPTY;
    }

    /**
     * Builds a ranking from raw member lists, numbering the fronts in list order and dropping empty lists.
     *
     * @param memberLists   Member ids per front.
     * @param allInfeasible The degenerate-case flag.
     * @return The ranking.
     */
    public static FrontRanking of(List<? extends IntList> memberLists, boolean allInfeasible) {
        List<Front> fronts = new ArrayList<>(memberLists.size());
        for (IntList members : memberLists) {
            if (!members.isEmpty()) {
                fronts.add(new Front(fronts.size(), members));
            }
        }
        return new FrontRanking(fronts, allInfeasible);
    }

    /**
     * @return Number of fronts.
     */
    public int frontCount() {
        return fronts.size();
    }

    /**
     * @param rank A front index.
     * @return The front at that depth.
     */
    public Front front(int rank) {
        return fronts.get(rank);
    }

    /**
     * @return Total number of ranked individuals.
     */
    public int rankedCount() {
        int count = 0;
        for (Front f : fronts) {
            count += f.size();
        }
        return count;
    }

    /**
     * @return {@code true} if nothing was ranked.
     */
    public boolean isEmpty() {
        return fronts.isEmpty();
    }

    /**
     * @param id An individual key.
     * @return The rank of that individual, or -1 if it is not covered by this ranking.
     */
    public int rankOf(int id) {
        for (Front f : fronts) {
            if (f.contains(id)) {
                return f.rank();
            }
        }
        return -1;
    }

    /**
     * @return All ranked ids, front by front.
     */
    public IntList flatten() {
        IntArrayList all = new IntArrayList(rankedCount());
        for (Front f : fronts) {
            all.addAll(f.members());
        }
        return all;
    }

    /**
     * Keeps the shortest prefix of fronts that covers at least {@code k} individuals.
     *
     * @param k Number of individuals the caller needs.
     * @return This ranking or a truncated copy.
     */
    public FrontRanking truncate(int k) {
        int count = 0;
        for (int i = 0; i < fronts.size(); i++) {
            count += fronts.get(i).size();
            if (count >= k) {
                return i + 1 == fronts.size() ? this : new FrontRanking(fronts.subList(0, i + 1), allInfeasible);
            }
        }
        return this;
    }
}
