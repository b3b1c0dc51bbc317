package org.evosel.selection.survival;

import com.typesafe.config.ConfigFactory;
import org.evosel.selection.internal.services.SeededRandomProvider;
import org.evosel.selection.model.Fitness;
import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;
import org.evosel.selection.sorting.FastFrontAssigner;
import org.evosel.selection.sorting.FeasibilityFirstAssigner;
import org.evosel.selection.sorting.NaiveFrontAssigner;
import org.evosel.selection.sorting.SortAlgorithm;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.evosel.test.utils.PopulationTestUtils.population;

/**
 * Unit tests for {@link CrowdingSurvival}.
 */
@Tag("unit")
class CrowdingSurvivalTest {

    /** Front 0: ids 0-2. Front 1: ids 3-6, where id 4 is the least crowded interior member. */
    private static Population twoFronts() {
        return population(
                new double[]{1, 5}, new double[]{3, 3}, new double[]{5, 1},
                new double[]{2, 6}, new double[]{4, 4}, new double[]{6, 2}, new double[]{6.5, 1.5});
    }

    private static Individual infeasible(int id, double violation, double... objectives) {
        return Individual.of(id, Fitness.constrained(objectives, violation));
    }

    @Test
    void cutsPartialFrontByDescendingCrowdingDistance() {
        List<Individual> survivors = new CrowdingSurvival(new FastFrontAssigner()).select(twoFronts(), 6);

        assertThat(survivors).extracting(Individual::id).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 6);
    }

    @Test
    void wholeFrontsAreTakenInRankOrder() {
        List<Individual> survivors = new CrowdingSurvival(new FastFrontAssigner()).select(twoFronts(), 3);

        assertThat(survivors).extracting(Individual::id).containsExactlyInAnyOrder(0, 1, 2);
    }

    @Test
    void smallPopulationSurvivesCompletely() {
        List<Individual> survivors = new CrowdingSurvival(new NaiveFrontAssigner()).select(twoFronts(), 50);

        assertThat(survivors).hasSize(7);
    }

    @Test
    void zeroSurvivorsRequested() {
        assertThat(new CrowdingSurvival(new FastFrontAssigner()).select(twoFronts(), 0)).isEmpty();
        assertThat(new CrowdingSurvival(new FastFrontAssigner()).select(Population.empty(), 4)).isEmpty();
    }

    @Test
    void readsSortingOptions() {
        CrowdingSurvival policy = new CrowdingSurvival(new SeededRandomProvider(1),
                ConfigFactory.parseString("algorithm = \"naive\"\nconstraints-aware = true"));

        assertThat(policy.getFrontAssigner()).isInstanceOf(FeasibilityFirstAssigner.class);
        assertThat(((FeasibilityFirstAssigner) policy.getFrontAssigner()).delegate())
                .isInstanceOf(NaiveFrontAssigner.class);
    }

    @Test
    void defaultsToFastWithoutConstraints() {
        CrowdingSurvival policy = new CrowdingSurvival(new SeededRandomProvider(1), ConfigFactory.empty());

        assertThat(policy.getFrontAssigner()).isInstanceOf(FastFrontAssigner.class);
    }

    @Test
    void invalidOptionNamesTheKey() {
        assertThatThrownBy(() -> new CrowdingSurvival(new SeededRandomProvider(1),
                ConfigFactory.parseString("constraints-aware = sometimes")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("constraints-aware");
    }

    @Test
    void allInfeasibleSurvivorsAreTheLeastViolating() {
        // id 1 is the interior member of its front, crowding alone would drop it
        Population population = Population.of(
                infeasible(0, 1.0, 1, 1),
                infeasible(1, 2.0, 5, 5),
                infeasible(2, 3.0, 0, 10),
                infeasible(3, 4.0, 10, 0));

        List<Individual> survivors = new CrowdingSurvival(SortAlgorithm.FAST.create(true)).select(population, 2);

        assertThat(survivors).extracting(Individual::id).containsExactly(0, 1);
    }

    @Test
    void infeasibleTrailingFrontIsCutByViolation() {
        Population population = Population.of(
                Individual.of(0, 1.0, 1.0),
                infeasible(1, 2.0, 5, 5),
                infeasible(2, 3.0, 0, 10),
                infeasible(3, 4.0, 10, 0));

        for (SortAlgorithm algorithm : SortAlgorithm.values()) {
            List<Individual> survivors = new CrowdingSurvival(algorithm.create(true)).select(population, 3);

            assertThat(survivors).extracting(Individual::id).containsExactly(0, 1, 2);
        }
    }

    @Test
    void infeasibleIndividualsAreCrowdedWithoutConstraints() {
        Population population = Population.of(
                infeasible(1, 2.0, 5, 5),
                infeasible(2, 3.0, 0, 10),
                infeasible(3, 4.0, 10, 0));

        List<Individual> survivors = new CrowdingSurvival(new FastFrontAssigner()).select(population, 2);

        assertThat(survivors).extracting(Individual::id).containsExactlyInAnyOrder(2, 3);
    }
}
