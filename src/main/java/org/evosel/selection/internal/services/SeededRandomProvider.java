package org.evosel.selection.internal.services;

import org.evosel.selection.spi.IRandomProvider;

import java.util.Random;

/**
 * {@link IRandomProvider} backed by a seeded {@link Random}.
 * <p>
 * Derived providers get their seed from a SplitMix64 mix of the parent seed, the context hash and
 * the salt.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    /**
     * @param seed The seed.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * @return The seed this provider was created with.
     */
    public long getSeed() {
        return seed;
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long mixed = mix(seed ^ mix(context.hashCode()));
        return new SeededRandomProvider(mix(mixed + salt));
    }

    private static long mix(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
