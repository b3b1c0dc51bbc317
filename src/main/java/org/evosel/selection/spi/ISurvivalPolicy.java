package org.evosel.selection.spi;

import org.evosel.selection.model.Individual;
import org.evosel.selection.model.Population;

import java.util.List;

/**
 * Environmental selection: reduces a combined parent and offspring population to the next generation.
 * <p>
 * Implementations are loaded by {@link org.evosel.selection.SelectionEngine} from the
 * {@code survival} configuration block and must provide a public constructor with the signature
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}.
 * <p>
 * Implementations may keep state across calls (e.g. normalization memory) and are not required to
 * be thread-safe.
 */
public interface ISurvivalPolicy {

    /**
     * Selects the survivors.
     *
     * @param population The candidates.
     * @param k          Number of survivors, {@code >= 0}.
     * @return Exactly {@code min(k, population.size())} distinct individuals.
     * @throws IllegalArgumentException if {@code k} is negative.
     */
    List<Individual> select(Population population, int k);
}
