package org.evosel.selection.survival;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.IntArrays;
import org.evosel.selection.crowding.CrowdingDistanceCalculator;
import org.evosel.selection.model.Front;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;
import org.evosel.selection.sorting.IFrontAssigner;
import org.evosel.selection.spi.IRandomProvider;
import org.evosel.selection.spi.ISurvivalPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * NSGA-II environmental selection.
 * <p>
 * Whole fronts are admitted while they fit; the front that does not fit is ordered by descending
 * crowding distance and cut. Equal distances keep the order of the front. A front of infeasible
 * individuals from a constraint-aware sorter is cut by increasing violation instead.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * survival {
 *   className = "org.evosel.selection.survival.CrowdingSurvival"
 *   options {
 *     algorithm = "FAST"          # or "NAIVE"
 *     constraints-aware = false
 *   }
 * }
 * </pre>
 */
public class CrowdingSurvival implements ISurvivalPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(CrowdingSurvival.class);

    private final IFrontAssigner frontAssigner;

    /**
     * Creates the policy from configuration.
     *
     * @param randomProvider Unused; part of the policy constructor contract.
     * @param options        The options block.
     */
    public CrowdingSurvival(IRandomProvider randomProvider, Config options) {
        this(SurvivalOptions.frontAssigner(options));
    }

    /**
     * @param frontAssigner The sorter ranking the candidates.
     */
    public CrowdingSurvival(IFrontAssigner frontAssigner) {
        this.frontAssigner = frontAssigner;
    }

    @Override
    public List<Individual> select(Population population, int k) {
        FrontRanking ranking = frontAssigner.assign(population, k);
        List<Individual> chosen = new ArrayList<>(Math.min(k, population.size()));
        for (Front front : ranking.fronts()) {
            if (chosen.size() + front.size() <= k) {
                for (int id : front.members()) {
                    chosen.add(population.byId(id));
                }
                continue;
            }
            int remaining = k - chosen.size();
            if (ranking.allInfeasible() || isViolationOrdered(front, population)) {
                for (int i = 0; i < remaining; i++) {
                    chosen.add(population.byId(front.members().getInt(i)));
                }
                LOG.debug("Cut infeasible front {} of {} to {} by violation", front.rank(), front.size(), remaining);
                break;
            }
            List<Individual> members = new ArrayList<>(front.size());
            for (int id : front.members()) {
                members.add(population.byId(id));
            }
            Int2DoubleMap distances = CrowdingDistanceCalculator.calculate(members);
            int[] order = new int[members.size()];
            for (int i = 0; i < order.length; i++) {
                order[i] = i;
            }
            IntArrays.mergeSort(order, (a, b) -> Double.compare(
                    distances.get(members.get(b).id()), distances.get(members.get(a).id())));
            for (int i = 0; i < remaining; i++) {
                chosen.add(members.get(order[i]));
            }
            LOG.debug("Cut front {} of {} to {} by crowding distance", front.rank(), front.size(), remaining);
            break;
        }
        return chosen;
    }

    /**
     * @return The sorter in use.
     */
    public IFrontAssigner getFrontAssigner() {
        return frontAssigner;
    }

    private boolean isViolationOrdered(Front front, Population population) {
        return frontAssigner.ordersInfeasibleByViolation()
                && !population.byId(front.members().getInt(0)).fitness().isFeasible();
    }
}
