package org.evosel.selection.sorting;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.evosel.selection.model.Front;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Constraint-aware decorator around any {@link IFrontAssigner}.
 * <p>
 * Separates feasible from infeasible individuals (feasible meaning zero total violation):
 * <ul>
 *   <li>No feasible individual at all: returns two pseudo-fronts, the least violating individual
 *       followed by everyone else in increasing violation, and flags the ranking as
 *       {@link FrontRanking#allInfeasible() all-infeasible}.</li>
 *   <li>Otherwise the delegate ranks the feasible individuals. When those fronts cover fewer than
 *       {@code k} individuals, the infeasible ones follow as a single trailing front in increasing
 *       violation.</li>
 * </ul>
 * This matches constraint-domination: any feasible individual dominates any infeasible one, and
 * infeasible individuals are ordered by violation alone.
 */
public class FeasibilityFirstAssigner implements IFrontAssigner {

    private static final Logger LOG = LoggerFactory.getLogger(FeasibilityFirstAssigner.class);

    private final IFrontAssigner delegate;

    /**
     * @param delegate Ranks the feasible subset.
     */
    public FeasibilityFirstAssigner(IFrontAssigner delegate) {
        this.delegate = delegate;
    }

    /**
     * @return The wrapped assigner.
     */
    public IFrontAssigner delegate() {
        return delegate;
    }

    @Override
    public boolean ordersInfeasibleByViolation() {
        return true;
    }

    /** {@inheritDoc} */
    @Override
    public FrontRanking assign(Population population, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got: " + k);
        }
        if (k == 0 || population.isEmpty()) {
            return FrontRanking.empty();
        }

        IntArrayList feasible = new IntArrayList();
        IntArrayList infeasible = new IntArrayList();
        for (int i = 0; i < population.size(); i++) {
            if (population.get(i).fitness().isFeasible()) {
                feasible.add(i);
            } else {
                infeasible.add(i);
            }
        }

        if (feasible.isEmpty()) {
            IntArrayList byViolation = sortedByViolation(population, infeasible);
            LOG.debug("No feasible individual among {}; ranking by violation only", population.size());
            IntArrayList best = new IntArrayList(new int[]{byViolation.getInt(0)});
            IntArrayList rest = new IntArrayList(byViolation.subList(1, byViolation.size()));
            return FrontRanking.of(List.of(best, rest), true);
        }

        FrontRanking ranked = delegate.assign(population.subset(feasible), k);
        if (infeasible.isEmpty() || ranked.rankedCount() >= k) {
            return ranked;
        }

        List<IntArrayList> fronts = new ArrayList<>(ranked.frontCount() + 1);
        for (Front front : ranked.fronts()) {
            fronts.add(new IntArrayList(front.members()));
        }
        fronts.add(sortedByViolation(population, infeasible));
        LOG.debug("Appended {} infeasible individuals after {} feasible fronts", infeasible.size(), ranked.frontCount());
        return FrontRanking.of(fronts, false);
    }

    /**
     * @return The ids at the given positions, in increasing total violation (stable).
     */
    private static IntArrayList sortedByViolation(Population population, IntArrayList positions) {
        int[] order = positions.toIntArray();
        double[] violation = new double[population.size()];
        for (int index : order) {
            violation[index] = population.get(index).fitness().totalViolation();
        }
        IntArrays.mergeSort(order, (a, b) -> Double.compare(violation[a], violation[b]));
        IntArrayList ids = new IntArrayList(order.length);
        for (int index : order) {
            ids.add(population.get(index).id());
        }
        return ids;
    }
}
