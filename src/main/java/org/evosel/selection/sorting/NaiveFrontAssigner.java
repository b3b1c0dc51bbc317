package org.evosel.selection.sorting;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.evosel.selection.dominance.DominanceRelation;
import org.evosel.selection.model.Fitness;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Population;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Dominance-counting non-dominated sort (Deb et al., NSGA-II, 2002).
 * <p>
 * Every pair of distinct fitness values is compared once, recording for each value how many others
 * dominate it and which ones it dominates. Front 0 holds the values nobody dominates; each further
 * front is peeled off by decrementing the counters of everything the previous front dominated.
 * Individuals with identical fitness are compared once as a group and share a rank.
 * <p>
 * O(M·N²) time and O(N²) memory in the worst case. Serves as the reference implementation for
 * {@link FastFrontAssigner} and is the faster choice for small populations.
 */
public class NaiveFrontAssigner implements IFrontAssigner {

    private static final Logger LOG = LoggerFactory.getLogger(NaiveFrontAssigner.class);

    private final DominanceRelation relation;

    /**
     * Creates an assigner using plain Pareto dominance.
     */
    public NaiveFrontAssigner() {
        this(DominanceRelation.PLAIN);
    }

    /**
     * @param relation The dominance relation used for the pairwise comparisons.
     */
    public NaiveFrontAssigner(DominanceRelation relation) {
        this.relation = relation;
    }

    /**
     * @return The dominance relation in use.
     */
    public DominanceRelation relation() {
        return relation;
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

        List<IntArrayList> groups = FitnessOrder.groupIdentical(population, relation == DominanceRelation.CONSTRAINED);
        int g = groups.size();
        Fitness[] fitness = new Fitness[g];
        for (int i = 0; i < g; i++) {
            fitness[i] = population.get(groups.get(i).getInt(0)).fitness();
        }

        // --- Phase 1: pairwise dominance counting ---
        int[] dominatedBy = new int[g];
        IntArrayList[] dominates = new IntArrayList[g];
        for (int i = 0; i < g; i++) {
            dominates[i] = new IntArrayList();
        }
        IntArrayList current = new IntArrayList();
        for (int i = 0; i < g; i++) {
            for (int j = i + 1; j < g; j++) {
                if (relation.dominates(fitness[i], fitness[j])) {
                    dominatedBy[j]++;
                    dominates[i].add(j);
                } else if (relation.dominates(fitness[j], fitness[i])) {
                    dominatedBy[i]++;
                    dominates[j].add(i);
                }
            }
            if (dominatedBy[i] == 0) {
                current.add(i);
            }
        }

        // --- Phase 2: peel fronts until k individuals are ranked ---
        List<IntArrayList> fronts = new ArrayList<>();
        int target = Math.min(population.size(), k);
        int ranked = 0;
        while (!current.isEmpty()) {
            IntArrayList members = new IntArrayList();
            for (int i = 0; i < current.size(); i++) {
                for (int index : groups.get(current.getInt(i))) {
                    members.add(population.get(index).id());
                }
            }
            fronts.add(members);
            ranked += members.size();
            if (ranked >= target) {
                break;
            }

            IntArrayList next = new IntArrayList();
            for (int i = 0; i < current.size(); i++) {
                IntArrayList dominated = dominates[current.getInt(i)];
                for (int j = 0; j < dominated.size(); j++) {
                    int d = dominated.getInt(j);
                    if (--dominatedBy[d] == 0) {
                        next.add(d);
                    }
                }
            }
            current = next;
        }

        LOG.debug("Naive sort ranked {} of {} individuals ({} distinct fitness values) into {} fronts",
                ranked, population.size(), g, fronts.size());
        return FrontRanking.of(fronts, false);
    }
}
