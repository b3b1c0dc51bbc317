package org.evosel.selection.sorting;

import org.evosel.selection.dominance.DominanceRelation;
import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Population;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evosel.test.utils.PopulationTestUtils.continuousPopulation;
import static org.evosel.test.utils.PopulationTestUtils.frontSets;
import static org.evosel.test.utils.PopulationTestUtils.gridPopulation;
import static org.evosel.test.utils.PopulationTestUtils.nondominatedIds;
import static org.evosel.test.utils.PopulationTestUtils.population;

/**
 * Unit tests for {@link FastFrontAssigner}, mostly checked against {@link NaiveFrontAssigner}.
 */
@Tag("unit")
class FastFrontAssignerTest {

    private final FastFrontAssigner fast = new FastFrontAssigner();
    private final NaiveFrontAssigner naive = new NaiveFrontAssigner();

    @ParameterizedTest
    @CsvSource({"2, 11", "3, 12", "4, 13", "5, 14", "6, 15"})
    void matchesNaivePartitionOnGridPopulations(int m, long seed) {
        Random random = new Random(seed);
        for (int trial = 0; trial < 40; trial++) {
            int size = 1 + random.nextInt(200);
            Population population = gridPopulation(random, size, m);

            assertThat(frontSets(fast.assign(population, size)))
                    .as("trial %d, N=%d, M=%d", trial, size, m)
                    .isEqualTo(frontSets(naive.assign(population, size)));
        }
    }

    @ParameterizedTest
    @CsvSource({"2, 21", "3, 22", "4, 23", "6, 24"})
    void matchesNaivePartitionOnContinuousPopulations(int m, long seed) {
        Random random = new Random(seed);
        for (int trial = 0; trial < 20; trial++) {
            int size = 1 + random.nextInt(200);
            Population population = continuousPopulation(random, size, m);

            assertThat(frontSets(fast.assign(population, size)))
                    .isEqualTo(frontSets(naive.assign(population, size)));
        }
    }

    @Test
    void frontsPartitionThePopulation() {
        Random random = new Random(3);
        for (int trial = 0; trial < 30; trial++) {
            int size = 1 + random.nextInt(200);
            Population population = gridPopulation(random, size, 2 + random.nextInt(5));

            FrontRanking ranking = fast.assign(population, size);

            Set<Integer> seen = new HashSet<>();
            for (Set<Integer> front : frontSets(ranking)) {
                for (int id : front) {
                    assertThat(seen.add(id)).as("id %d ranked twice", id).isTrue();
                }
            }
            assertThat(seen).hasSize(size);
        }
    }

    @Test
    void firstFrontIsExactlyTheNonDominatedSet() {
        Random random = new Random(5);
        for (int trial = 0; trial < 30; trial++) {
            Population population = gridPopulation(random, 1 + random.nextInt(150), 2 + random.nextInt(5));

            assertThat(frontSets(fast.assign(population, population.size())).get(0))
                    .isEqualTo(nondominatedIds(population, DominanceRelation.PLAIN));
        }
    }

    @Test
    void truncatesLikeNaive() {
        Random random = new Random(9);
        Population population = gridPopulation(random, 120, 3);

        for (int k : new int[]{1, 10, 60, 119}) {
            assertThat(frontSets(fast.assign(population, k))).isEqualTo(frontSets(naive.assign(population, k)));
        }
    }

    @Test
    void singleObjectiveRanksDistinctValues() {
        Population population = population(new double[]{3}, new double[]{1}, new double[]{3}, new double[]{2});

        assertThat(frontSets(fast.assign(population, 4))).containsExactly(Set.of(1), Set.of(3), Set.of(0, 2));
    }

    @Test
    void allIdenticalFormOneFront() {
        Population population = population(new double[]{1, 1, 1}, new double[]{1, 1, 1}, new double[]{1, 1, 1});

        assertThat(fast.assign(population, 3).frontCount()).isEqualTo(1);
    }

    @Test
    void ranksObjectivesNearTheLargestDouble() {
        Population population = population(
                new double[]{1, 4, 1e308}, new double[]{2, 3, 1e308}, new double[]{3, 2, 1.7e308},
                new double[]{4, 1, 1.7e308}, new double[]{2, 4, 1.7e308});

        assertThat(frontSets(fast.assign(population, 5))).containsExactly(Set.of(0, 1, 2, 3), Set.of(4));
    }

    @Test
    void ranksInfiniteObjectives() {
        double inf = Double.POSITIVE_INFINITY;
        Population population = population(
                new double[]{1, 4, -inf}, new double[]{2, 3, -inf}, new double[]{3, 2, inf},
                new double[]{4, 1, inf}, new double[]{4, 4, inf});

        assertThat(frontSets(fast.assign(population, 5))).containsExactly(Set.of(0, 1, 2, 3), Set.of(4));
    }

    @Test
    void matchesNaivePartitionOnExtremeValues() {
        double[] pool = {Double.NEGATIVE_INFINITY, -1.7e308, -1e308, 0.0, 1.0, 1e308, 1.7e308, Double.POSITIVE_INFINITY};
        Random random = new Random(21);
        for (int trial = 0; trial < 200; trial++) {
            int m = 2 + random.nextInt(4);
            double[][] objectives = new double[1 + random.nextInt(40)][m];
            for (double[] row : objectives) {
                for (int j = 0; j < m; j++) {
                    row[j] = pool[random.nextInt(pool.length)];
                }
            }
            Population population = population(objectives);

            assertThat(frontSets(fast.assign(population, population.size())))
                    .isEqualTo(frontSets(naive.assign(population, population.size())));
        }
    }
}
