package org.evosel.selection;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.evosel.selection.model.FrontRanking;
import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;
import org.evosel.selection.sorting.IFrontAssigner;
import org.evosel.selection.sorting.SortAlgorithm;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * JMH benchmark for non-dominated sorting.
 * <p>
 * Compares the dominance-counting and the divide-and-conquer assigner on random populations
 * ranked completely ({@code k = N}).
 * <p>
 * Run with: {@code mvn -Pjmh package && java -cp target/benchmarks.jar org.openjdk.jmh.Main}
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
public class FrontSortingBenchmark {

    private static final long SEED = 42L;

    /** Number of individuals. */
    @Param({"100", "1000", "5000"})
    private int populationSize;

    /** Number of objectives. */
    @Param({"2", "3", "5"})
    private int objectives;

    /** Sorting implementation. */
    @Param({"NAIVE", "FAST"})
    private String algorithm;

    private Population population;
    private IFrontAssigner assigner;

    /**
     * Builds the population and the assigner once per trial.
     */
    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(SEED);
        List<Individual> members = new ArrayList<>(populationSize);
        for (int i = 0; i < populationSize; i++) {
            double[] f = new double[objectives];
            for (int j = 0; j < objectives; j++) {
                f[j] = random.nextDouble();
            }
            members.add(Individual.of(i, f));
        }
        population = Population.of(members);
        assigner = SortAlgorithm.fromName(algorithm).create(false);
    }

    /**
     * Ranks the whole population.
     *
     * @return the ranking (prevents dead-code elimination)
     */
    @Benchmark
    public FrontRanking sortAll() {
        return assigner.assign(population, populationSize);
    }
}
