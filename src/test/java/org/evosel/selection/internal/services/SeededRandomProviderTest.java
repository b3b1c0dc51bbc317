package org.evosel.selection.internal.services;

import org.evosel.selection.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeededRandomProvider}.
 */
@Tag("unit")
class SeededRandomProviderTest {

    private static double[] draw(IRandomProvider provider, int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = provider.asJavaRandom().nextDouble();
        }
        return values;
    }

    @Test
    void sameSeedSameSequence() {
        assertThat(draw(new SeededRandomProvider(5), 20)).containsExactly(draw(new SeededRandomProvider(5), 20));
    }

    @Test
    void javaRandomIsOneSharedStream() {
        SeededRandomProvider provider = new SeededRandomProvider(5);

        assertThat(provider.asJavaRandom()).isSameAs(provider.asJavaRandom());
        assertThat(provider.getSeed()).isEqualTo(5L);
    }

    @Test
    void derivedStreamDependsOnSeedContextAndSaltOnly() {
        SeededRandomProvider fresh = new SeededRandomProvider(11);
        SeededRandomProvider used = new SeededRandomProvider(11);
        draw(used, 50);

        assertThat(draw(used.deriveFor("niching", 0), 10))
                .containsExactly(draw(fresh.deriveFor("niching", 0), 10));
    }

    @Test
    void differentContextsGiveDifferentStreams() {
        SeededRandomProvider root = new SeededRandomProvider(11);

        assertThat(draw(root.deriveFor("niching", 0), 10))
                .isNotEqualTo(draw(root.deriveFor("survival", 0), 10));
        assertThat(draw(root.deriveFor("niching", 0), 10))
                .isNotEqualTo(draw(root.deriveFor("niching", 1), 10));
        assertThat(draw(root.deriveFor("niching", 0), 10))
                .isNotEqualTo(draw(new SeededRandomProvider(12).deriveFor("niching", 0), 10));
    }
}
