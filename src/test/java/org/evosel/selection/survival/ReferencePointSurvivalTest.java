package org.evosel.selection.survival;

import com.typesafe.config.ConfigFactory;
import org.evosel.selection.internal.services.SeededRandomProvider;
import org.evosel.selection.model.Fitness;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;
import org.evosel.selection.sorting.FastFrontAssigner;
import org.evosel.selection.sorting.NaiveFrontAssigner;
import org.evosel.selection.sorting.SortAlgorithm;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.evosel.test.utils.PopulationTestUtils.continuousPopulation;
import static org.evosel.test.utils.PopulationTestUtils.frontSets;
import static org.evosel.test.utils.PopulationTestUtils.gridPopulation;
import static org.evosel.test.utils.PopulationTestUtils.population;

/**
 * Unit tests for {@link ReferencePointSurvival}.
 */
@Tag("unit")
class ReferencePointSurvivalTest {

    private static ReferencePointSurvival policy(long seed, int divisions, boolean memory) {
        return new ReferencePointSurvival(new SeededRandomProvider(seed), new FastFrontAssigner(),
                new int[]{divisions}, new double[]{1.0}, memory);
    }

    private static Set<Integer> ids(List<Individual> individuals) {
        Set<Integer> ids = new HashSet<>();
        for (Individual individual : individuals) {
            ids.add(individual.id());
        }
        return ids;
    }

    @Test
    void selectsExactlyKDistinctIndividuals() {
        Random random = new Random(8);
        for (int trial = 0; trial < 30; trial++) {
            int m = 2 + trial % 4;
            Population population = random.nextBoolean()
                    ? gridPopulation(random, 20 + random.nextInt(80), m)
                    : continuousPopulation(random, 20 + random.nextInt(80), m);
            ReferencePointSurvival survival = policy(trial, 6, true);
            int k = 1 + random.nextInt(population.size());

            List<Individual> survivors = survival.select(population, k);

            assertThat(survivors).hasSize(k);
            assertThat(ids(survivors)).hasSize(k);
        }
    }

    @Test
    void admitsEveryFrontThatFitsCompletely() {
        Random random = new Random(12);
        for (int trial = 0; trial < 20; trial++) {
            Population population = gridPopulation(random, 60, 3);
            int k = 1 + random.nextInt(59);

            Set<Integer> survivors = ids(policy(trial, 4, false).select(population, k));

            FrontRanking ranking = new NaiveFrontAssigner().assign(population, population.size());
            int admitted = 0;
            for (Set<Integer> front : frontSets(ranking)) {
                if (admitted + front.size() <= k) {
                    assertThat(survivors).containsAll(front);
                    admitted += front.size();
                } else {
                    Set<Integer> fromFront = new HashSet<>(survivors);
                    fromFront.retainAll(front);
                    assertThat(fromFront).hasSize(k - admitted);
                    break;
                }
            }
        }
    }

    @Test
    void prefersIndividualsOnTheReferenceLines() {
        Population population = population(
                new double[]{0, 1}, new double[]{0.1, 0.9}, new double[]{0.9, 0.1}, new double[]{1, 0});

        for (long seed = 0; seed < 10; seed++) {
            List<Individual> survivors = policy(seed, 1, false).select(population, 2);

            assertThat(survivors).extracting(Individual::id).containsExactlyInAnyOrder(0, 3);
        }
    }

    @Test
    void sameSeedSameSurvivors() {
        Population population = gridPopulation(new Random(4), 80, 3);

        List<Individual> first = policy(77, 5, true).select(population, 30);
        List<Individual> second = policy(77, 5, true).select(population, 30);

        assertThat(first).extracting(Individual::id)
                .containsExactlyElementsOf(second.stream().map(Individual::id).toList());
    }

    @Test
    void smallPopulationSurvivesCompletelyAndUpdatesMemory() {
        ReferencePointSurvival survival = policy(1, 4, true);
        Population population = population(new double[]{1, 2}, new double[]{2, 1}, new double[]{3, 3});

        List<Individual> survivors = survival.select(population, 5);

        assertThat(survivors).hasSize(3);
        assertThat(survival.getMemory().isEmpty()).isFalse();
        assertThat(survival.getMemory().idealPoint()).containsExactly(1.0, 1.0);
    }

    @Test
    void zeroOrEmptyGivesNoSurvivors() {
        assertThat(policy(1, 4, true).select(population(new double[]{1, 2}), 0)).isEmpty();
        assertThat(policy(1, 4, true).select(Population.empty(), 3)).isEmpty();
    }

    @Test
    void memoryCanBeDisabled() {
        assertThat(policy(1, 4, false).getMemory()).isNull();
    }

    @Test
    void readsLayersFromConfiguration() {
        ReferencePointSurvival survival = new ReferencePointSurvival(new SeededRandomProvider(1),
                ConfigFactory.parseString("divisions = [3, 2]\nscalings = [1.0, 0.5]\nmemory = false"));

        double[][] points = survival.referencePointsFor(3);

        assertThat(points.length).isEqualTo(10 + 6);
        assertThat(survival.referencePointsFor(3)).isSameAs(points);
        assertThat(survival.getMemory()).isNull();
    }

    @Test
    void scalingsDefaultToOne() {
        ReferencePointSurvival survival = new ReferencePointSurvival(new SeededRandomProvider(1),
                ConfigFactory.parseString("divisions = [4]"));

        assertThat(survival.referencePointsFor(2).length).isEqualTo(5);
        assertThat(survival.getMemory()).isNotNull();
    }

    @Test
    void mismatchedLayersAreRejected() {
        assertThatThrownBy(() -> new ReferencePointSurvival(new SeededRandomProvider(1),
                ConfigFactory.parseString("divisions = [4]\nscalings = [1.0, 0.5]")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingDivisionsNamesTheKey() {
        assertThatThrownBy(() -> new ReferencePointSurvival(new SeededRandomProvider(1), ConfigFactory.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("divisions");
    }

    @Test
    void infeasibleLastFrontIsCutByViolation() {
        Population allInfeasible = Population.of(
                Individual.of(0, Fitness.constrained(new double[]{1, 1}, 1.0)),
                Individual.of(1, Fitness.constrained(new double[]{5, 5}, 2.0)),
                Individual.of(2, Fitness.constrained(new double[]{0, 10}, 3.0)),
                Individual.of(3, Fitness.constrained(new double[]{10, 0}, 4.0)));
        Population oneFeasible = Population.of(
                Individual.of(0, 1.0, 1.0),
                Individual.of(1, Fitness.constrained(new double[]{5, 5}, 2.0)),
                Individual.of(2, Fitness.constrained(new double[]{0, 10}, 3.0)),
                Individual.of(3, Fitness.constrained(new double[]{10, 0}, 4.0)));

        for (long seed = 0; seed < 5; seed++) {
            ReferencePointSurvival survival = new ReferencePointSurvival(new SeededRandomProvider(seed),
                    SortAlgorithm.FAST.create(true), new int[]{1}, new double[]{1.0}, false);

            assertThat(survival.select(allInfeasible, 2)).extracting(Individual::id).containsExactly(0, 1);
            assertThat(survival.select(oneFeasible, 3)).extracting(Individual::id).containsExactly(0, 1, 2);
        }
    }

    @Test
    void constraintsAwareOptionRanksFeasibleFirst() {
        ReferencePointSurvival survival = new ReferencePointSurvival(new SeededRandomProvider(1),
                ConfigFactory.parseString("divisions = [2]\nconstraints-aware = true"));
        Population population = Population.of(
                Individual.of(0, 3.0, 3.0),
                Individual.of(1, Fitness.constrained(new double[]{1, 1}, 0.5)),
                Individual.of(2, Fitness.constrained(new double[]{0, 0}, 2.0)));

        assertThat(survival.select(population, 2)).extracting(Individual::id).containsExactly(0, 1);
    }
}
