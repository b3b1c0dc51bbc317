package org.evosel.selection.spi;

import java.util.Random;

/**
 * Source of randomness for selection components.
 * <p>
 * Components that break ties randomly take a provider in their constructor and call
 * {@link #asJavaRandom()} once. Two providers built from the same seed yield the same sequence, so
 * a selection run is reproducible from its seed alone.
 */
public interface IRandomProvider {

    /**
     * @return A {@link Random} backed by this provider. Repeated calls return the same instance.
     */
    Random asJavaRandom();

    /**
     * Derives an independent sub-stream for one consumer.
     * <p>
     * The derived stream depends only on this provider's seed, the context and the salt, never on
     * how much of this provider's own stream has been consumed.
     *
     * @param context Name of the consumer, e.g. {@code "niching"}.
     * @param salt    Further discriminator, e.g. a generation number.
     * @return A new provider.
     */
    IRandomProvider deriveFor(String context, long salt);
}
