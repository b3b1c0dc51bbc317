package org.evosel.selection;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.evosel.selection.config.ConfigLoader;
import org.evosel.selection.crowding.CrowdingDistanceCalculator;
import org.evosel.selection.internal.services.SeededRandomProvider;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;
import org.evosel.selection.niching.NicheAssignment;
import org.evosel.selection.niching.NicheAssociator;
import org.evosel.selection.niching.NicheCounts;
import org.evosel.selection.niching.NichingSelector;
import org.evosel.selection.niching.ReferencePointGenerator;
import org.evosel.selection.sorting.SortAlgorithm;
import org.evosel.selection.spi.IRandomProvider;
import org.evosel.selection.spi.ISurvivalPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the selection library.
 * <p>
 * Bundles non-dominated sorting, crowding distance, reference-point generation and niching behind
 * one object configured from the {@code evosel.selection} block:
 * <pre>
 * evosel.selection {
 *   sorting { algorithm = "FAST", constraints-aware = false }
 *   survival {
 *     className = "org.evosel.selection.survival.ReferencePointSurvival"
 *     options { ... }
 *   }
 * }
 * </pre>
 * The survival policy is instantiated reflectively with the constructor
 * {@code (IRandomProvider, com.typesafe.config.Config)}. Each randomized component receives its
 * own stream derived from the engine's provider, so results depend on the seed only.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. The survival policy and the niching stream keep
 * state between calls.
 */
public class SelectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SelectionEngine.class);

    private final SortAlgorithm defaultAlgorithm;
    private final boolean defaultConstraintsAware;
    private final NichingSelector nichingSelector;
    private final ISurvivalPolicy survivalPolicy;

    /**
     * Creates an engine from a {@code evosel.selection} block.
     *
     * @param selectionConfig The selection block.
     * @param randomProvider  Root source of randomness.
     * @throws IllegalArgumentException if a value is invalid or the survival policy cannot be created.
     */
    public SelectionEngine(Config selectionConfig, IRandomProvider randomProvider) {
        Config sorting = selectionConfig.hasPath("sorting") ? selectionConfig.getConfig("sorting") : ConfigFactory.empty();
        try {
            this.defaultAlgorithm = sorting.hasPath("algorithm")
                    ? SortAlgorithm.fromName(sorting.getString("algorithm"))
                    : SortAlgorithm.FAST;
            this.defaultConstraintsAware = sorting.hasPath("constraints-aware") && sorting.getBoolean("constraints-aware");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid sorting configuration: " + e.getMessage(), e);
        }
        this.nichingSelector = new NichingSelector(randomProvider.deriveFor("niching", 0));
        this.survivalPolicy = createSurvivalPolicy(selectionConfig.getConfig("survival"),
                randomProvider.deriveFor("survival", 0));
    }

    /**
     * Creates an engine from {@code reference.conf}, system properties and environment.
     *
     * @param seed Seed of the root random stream.
     * @return A new engine.
     */
    public static SelectionEngine fromDefaults(long seed) {
        return new SelectionEngine(ConfigLoader.selection(ConfigLoader.loadDefaults()), new SeededRandomProvider(seed));
    }

    /**
     * Creates an engine from a HOCON file layered over {@code reference.conf}.
     *
     * @param selectionFile The file, or {@code null} to use {@code -Dconfig.file} or
     *                      {@value ConfigLoader#DEFAULT_FILE} when present.
     * @param seed          Seed of the root random stream.
     * @return A new engine.
     * @throws IllegalArgumentException if a named file is missing or the configuration is invalid.
     */
    public static SelectionEngine fromFile(File selectionFile, long seed) {
        return new SelectionEngine(ConfigLoader.selection(ConfigLoader.resolve(selectionFile)),
                new SeededRandomProvider(seed));
    }

    /**
     * Sorts with the configured algorithm and constraint mode.
     *
     * @param population The candidates.
     * @param k          Number of individuals that must be ranked.
     * @return Fronts covering at least {@code k} individuals, or all of them.
     */
    public FrontRanking sortFronts(Population population, int k) {
        return sortFronts(population, k, defaultConstraintsAware, defaultAlgorithm);
    }

    /**
     * @param population       The candidates.
     * @param k                Number of individuals that must be ranked.
     * @param constraintsAware Whether feasibility takes precedence over objectives.
     * @param algorithm        The sorting algorithm.
     * @return Fronts covering at least {@code k} individuals, or all of them.
     */
    public FrontRanking sortFronts(Population population, int k, boolean constraintsAware, SortAlgorithm algorithm) {
        FrontRanking ranking = algorithm.create(constraintsAware).assign(population, k);
        LOG.debug("Sorted {} individuals into {} fronts ({}, constraints-aware={})",
                ranking.rankedCount(), ranking.frontCount(), algorithm, constraintsAware);
        return ranking;
    }

    /**
     * @param frontMembers Members of one front.
     * @return Crowding distance per individual id.
     */
    public Int2DoubleMap assignCrowdingDistance(List<Individual> frontMembers) {
        return CrowdingDistanceCalculator.calculate(frontMembers);
    }

    /**
     * @param objectives Number of objectives M.
     * @param divisions  Divisions p per axis.
     * @return {@code C(p+M-1, M-1)} reference points on the unit simplex.
     */
    public double[][] uniformReferencePoints(int objectives, int divisions) {
        return ReferencePointGenerator.uniform(objectives, divisions);
    }

    /**
     * @param objectives Number of objectives M.
     * @param divisions  Divisions p per axis.
     * @param scaling    Shrink factor toward the centroid, in {@code (0, 1]}.
     * @return The scaled lattice.
     */
    public double[][] uniformReferencePoints(int objectives, int divisions, double scaling) {
        return ReferencePointGenerator.uniform(objectives, divisions, scaling);
    }

    /**
     * Fills {@code k} slots from the last front by niching.
     *
     * @param lastFrontMembers Members of the partially admitted front.
     * @param k                Slots to fill.
     * @param referencePoints  Reference directions, R x M.
     * @param idealPoint       The ideal point.
     * @param intercepts       Absolute hyperplane intercepts.
     * @param nicheCounts      Counts of the already admitted individuals; incremented in place.
     * @return {@code min(k, lastFrontMembers.size())} distinct members, in admission order.
     */
    public List<Individual> selectByNiching(List<Individual> lastFrontMembers, int k, double[][] referencePoints,
                                            double[] idealPoint, double[] intercepts, NicheCounts nicheCounts) {
        if (referencePoints.length != nicheCounts.size()) {
            throw new IllegalArgumentException("Got " + referencePoints.length + " reference points but "
                    + nicheCounts.size() + " niche counts");
        }
        double[][] fitnesses = new double[lastFrontMembers.size()][];
        for (int i = 0; i < fitnesses.length; i++) {
            fitnesses[i] = lastFrontMembers.get(i).objectives();
            if (fitnesses[i].length != idealPoint.length) {
                throw new IllegalArgumentException("Individual " + lastFrontMembers.get(i).id() + " has "
                        + fitnesses[i].length + " objectives, expected " + idealPoint.length);
            }
        }
        NicheAssignment assignment = NicheAssociator.associate(fitnesses, referencePoints, idealPoint, intercepts);
        IntArrayList picks = nichingSelector.select(k, assignment, nicheCounts);
        List<Individual> selected = new ArrayList<>(picks.size());
        for (int p : picks) {
            selected.add(lastFrontMembers.get(p));
        }
        return selected;
    }

    /**
     * Runs the configured survival policy.
     *
     * @param population The combined parents and offspring.
     * @param k          Number of survivors.
     * @return Exactly {@code min(k, population.size())} individuals.
     */
    public List<Individual> survive(Population population, int k) {
        return survivalPolicy.select(population, k);
    }

    /**
     * @return The configured survival policy.
     */
    public ISurvivalPolicy getSurvivalPolicy() {
        return survivalPolicy;
    }

    /**
     * @return The algorithm used by {@link #sortFronts(Population, int)}.
     */
    public SortAlgorithm getDefaultAlgorithm() {
        return defaultAlgorithm;
    }

    /**
     * @return The constraint mode used by {@link #sortFronts(Population, int)}.
     */
    public boolean isDefaultConstraintsAware() {
        return defaultConstraintsAware;
    }

    private static ISurvivalPolicy createSurvivalPolicy(Config config, IRandomProvider random) {
        String className = config.getString("className");
        Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> clazz = Class.forName(className);
            if (!ISurvivalPolicy.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not implement ISurvivalPolicy");
            }
            ISurvivalPolicy policy = (ISurvivalPolicy) clazz
                    .getConstructor(IRandomProvider.class, Config.class)
                    .newInstance(random, options);
            LOG.info("Loaded survival policy {}", clazz.getSimpleName());
            return policy;
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate survival policy: " + className, e);
        }
    }
}
