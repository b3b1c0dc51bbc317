package org.evosel.selection.survival;

import com.typesafe.config.Config;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.evosel.selection.model.Front;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;
import org.evosel.selection.niching.NicheAssignment;
import org.evosel.selection.niching.NicheAssociator;
import org.evosel.selection.niching.NicheCounts;
import org.evosel.selection.niching.NichingSelector;
import org.evosel.selection.niching.Normalization;
import org.evosel.selection.niching.NormalizationMemory;
import org.evosel.selection.niching.Normalizer;
import org.evosel.selection.niching.ReferencePointGenerator;
import org.evosel.selection.sorting.IFrontAssigner;
import org.evosel.selection.spi.IRandomProvider;
import org.evosel.selection.spi.ISurvivalPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * NSGA-III environmental selection (Deb and Jain 2014).
 * <p>
 * Sorts the candidates until at least {@code k} are ranked, normalizes every ranked candidate,
 * associates them with the reference directions and admits all fronts but the last. The remaining
 * slots are filled from the last front by {@link NichingSelector}, with niche counts taken from the
 * admitted fronts. A last front of infeasible individuals from a constraint-aware sorter is
 * already in increasing violation and is cut at its head without niching.
 * <p>
 * With {@code memory = true} the ideal point, worst point and extreme points are carried from one
 * call to the next, so consecutive generations share one normalization history.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * survival {
 *   className = "org.evosel.selection.survival.ReferencePointSurvival"
 *   options {
 *     divisions = [12]       # one entry per reference-point layer
 *     scalings = [1.0]       # optional, same length as divisions
 *     algorithm = "FAST"
 *     constraints-aware = false
 *     memory = true
 *   }
 * }
 * </pre>
 * Reference points are generated lazily per objective count.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; holds the normalization memory and the niching
 * random stream.
 */
public class ReferencePointSurvival implements ISurvivalPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(ReferencePointSurvival.class);

    private final IFrontAssigner frontAssigner;
    private final NichingSelector nichingSelector;
    private final int[] divisions;
    private final double[] scalings;
    private final NormalizationMemory memory;
    private final Int2ObjectOpenHashMap<double[][]> referencePoints = new Int2ObjectOpenHashMap<>();

    /**
     * Creates the policy from configuration.
     *
     * @param randomProvider Source of the niching tie-breaks.
     * @param options        The options block.
     */
    public ReferencePointSurvival(IRandomProvider randomProvider, Config options) {
        this(randomProvider, SurvivalOptions.frontAssigner(options), readDivisions(options), readScalings(options),
                SurvivalOptions.getBoolean(options, "memory", true));
    }

    /**
     * @param randomProvider Source of the niching tie-breaks.
     * @param frontAssigner  The sorter ranking the candidates.
     * @param divisions      Divisions per reference-point layer.
     * @param scalings       Scaling per layer, same length as {@code divisions}.
     * @param memory         Whether the normalization is carried across calls.
     */
    public ReferencePointSurvival(IRandomProvider randomProvider, IFrontAssigner frontAssigner,
                                  int[] divisions, double[] scalings, boolean memory) {
        if (divisions.length == 0) {
            throw new IllegalArgumentException("At least one reference-point layer is required");
        }
        if (divisions.length != scalings.length) {
            throw new IllegalArgumentException("Got " + divisions.length + " division counts but "
                    + scalings.length + " scalings");
        }
        this.frontAssigner = frontAssigner;
        this.nichingSelector = new NichingSelector(randomProvider);
        this.divisions = divisions.clone();
        this.scalings = scalings.clone();
        this.memory = memory ? new NormalizationMemory() : null;
    }

    @Override
    public List<Individual> select(Population population, int k) {
        FrontRanking ranking = frontAssigner.assign(population, k);
        if (ranking.isEmpty()) {
            return List.of();
        }
        IntList ranked = ranking.flatten();
        double[][] fitnesses = new double[ranked.size()][];
        for (int i = 0; i < ranked.size(); i++) {
            fitnesses[i] = population.byId(ranked.getInt(i)).objectives();
        }

        Normalization normalization = Normalizer.normalize(fitnesses, memory);
        double[][] points = referencePointsFor(population.objectiveCount());

        List<Individual> chosen = new ArrayList<>(Math.min(k, ranked.size()));
        if (ranked.size() <= k) {
            for (int id : ranked) {
                chosen.add(population.byId(id));
            }
            return chosen;
        }

        Front last = ranking.front(ranking.frontCount() - 1);
        int admitted = ranked.size() - last.size();
        for (int i = 0; i < admitted; i++) {
            chosen.add(population.byId(ranked.getInt(i)));
        }
        if (ranking.allInfeasible() || isViolationOrdered(last, population)) {
            for (int i = admitted; i < k; i++) {
                chosen.add(population.byId(ranked.getInt(i)));
            }
            LOG.debug("Admitted {} from {} fronts and {} of {} infeasible by violation",
                    admitted, ranking.frontCount() - 1, k - admitted, last.size());
            return chosen;
        }

        NicheAssignment assignment = NicheAssociator.associate(fitnesses, points, normalization);
        NicheCounts counts = NicheCounts.of(points.length, assignment, 0, admitted);
        IntArrayList picks = nichingSelector.select(k - admitted,
                assignment.range(admitted, ranked.size()), counts);
        for (int p : picks) {
            chosen.add(population.byId(ranked.getInt(admitted + p)));
        }
        LOG.debug("Admitted {} from {} fronts and {} of {} by niching over {} reference points",
                admitted, ranking.frontCount() - 1, picks.size(), ranked.size() - admitted, points.length);
        return chosen;
    }

    /**
     * @param objectives Number of objectives M.
     * @return The reference points for M objectives, generated on first use.
     */
    public double[][] referencePointsFor(int objectives) {
        double[][] points = referencePoints.get(objectives);
        if (points == null) {
            points = ReferencePointGenerator.layered(objectives, divisions, scalings);
            referencePoints.put(objectives, points);
        }
        return points;
    }

    /**
     * @return The normalization memory, or {@code null} if memory is disabled.
     */
    public NormalizationMemory getMemory() {
        return memory;
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

    private static int[] readDivisions(Config options) {
        List<Integer> values = SurvivalOptions.getIntList(options, "divisions");
        int[] divisions = new int[values.size()];
        for (int i = 0; i < divisions.length; i++) {
            divisions[i] = values.get(i);
        }
        return divisions;
    }

    private static double[] readScalings(Config options) {
        if (!options.hasPath("scalings")) {
            double[] ones = new double[SurvivalOptions.getIntList(options, "divisions").size()];
            Arrays.fill(ones, 1.0);
            return ones;
        }
        List<Double> values = SurvivalOptions.getDoubleList(options, "scalings");
        double[] scalings = new double[values.size()];
        for (int i = 0; i < scalings.length; i++) {
            scalings[i] = values.get(i);
        }
        return scalings;
    }
}
