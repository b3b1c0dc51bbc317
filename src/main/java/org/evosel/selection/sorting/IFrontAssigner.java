package org.evosel.selection.sorting;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.evosel.selection.model.Front;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Population;

/**
 * Strategy interface for non-dominated sorting.
 * <p>
 * Implementations partition a population into fronts of increasing dominance depth. Every
 * implementation must produce the same partition (as sets of ids) for the same input; they may
 * differ in the order of members inside a front and in running time.
 * <p>
 * Thread Safety: implementations are stateless between calls and may be shared.
 *
 * @see SortAlgorithm
 */
public interface IFrontAssigner {

    /**
     * Ranks the population into fronts.
     * <p>
     * Ranking stops as soon as the returned fronts cover at least {@code k} individuals. When the
     * population holds fewer than {@code k} individuals, every individual is ranked.
     *
     * @param population The population snapshot.
     * @param k          The number of individuals the caller needs ranked, {@code >= 0}.
     * @return The fronts, empty if {@code k == 0} or the population is empty.
     * @throws IllegalArgumentException if {@code k} is negative.
     */
    FrontRanking assign(Population population, int k);

    /**
     * Returns only the globally non-dominated level.
     *
     * @param population The population snapshot.
     * @return Front 0, with no members if the population is empty.
     */
    default Front firstFront(Population population) {
        FrontRanking ranking = assign(population, 1);
        return ranking.isEmpty() ? new Front(0, new IntArrayList()) : ranking.front(0);
    }

    /**
     * Whether infeasible individuals end up in fronts of their own, ordered by increasing total
     * violation. Such a front is already in survival order and must be cut by taking its head.
     *
     * @return {@code true} for constraint-aware assigners.
     */
    default boolean ordersInfeasibleByViolation() {
        return false;
    }
}
