package io.logictree.core.realization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.logictree.core.exception.SamplingException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class WeightedSamplerTest {

    private final WeightedSampler sampler = new WeightedSampler(1e-8);

    @Test
    void shouldReproduceDrawsForSameSeed() {
        double[] weights = {0.2, 0.5, 0.3};

        int[] first = sampler.sample("bs1", weights, 500, 11L);
        int[] second = sampler.sample("bs1", weights, 500, 11L);

        assertThat(first).hasSize(500).isEqualTo(second);
        assertThat(Arrays.stream(first).allMatch(i -> i >= 0 && i < 3)).isTrue();
    }

    @Test
    void shouldNeverDrawZeroWeight() {
        assertThat(sampler.sample("bs1", new double[] {0.0, 1.0}, 200, 3L)).containsOnly(1);
        assertThat(sampler.sample("bs1", new double[] {1.0, 0.0}, 200, 3L)).containsOnly(0);
    }

    @Test
    void shouldConvergeToWeights() {
        // Given
        double[] weights = {0.1, 0.6, 0.3};
        int n = 30_000;

        // When
        int[] draws = sampler.sample("bs1", weights, n, 2024L);

        // Then
        long[] observed = new long[weights.length];
        for (int draw : draws) {
            observed[draw]++;
        }
        double chiSquare = 0.0;
        for (int i = 0; i < weights.length; i++) {
            double expected = weights[i] * n;
            chiSquare += Math.pow(observed[i] - expected, 2) / expected;
        }
        // critical value for 2 degrees of freedom at p = 0.001
        assertThat(chiSquare).isLessThan(13.816);
    }

    @Test
    void shouldAcceptSumWithinTolerance() {
        assertThat(sampler.sample("bs1", new double[] {0.1, 0.2, 0.7 - 1e-12}, 10, 1L))
                .hasSize(10);
        assertThat(new WeightedSampler(0.1).sample("bs1", new double[] {0.5, 0.45}, 10, 1L))
                .hasSize(10);
    }

    @Test
    void shouldRejectWeightsNotSummingToOne() {
        assertThatThrownBy(() -> sampler.sample("bs1", new double[] {0.3, 0.3}, 10, 1L))
                .isInstanceOf(SamplingException.class)
                .hasMessageContaining("'bs1'")
                .hasMessageContaining("expected 1");
    }

    @Test
    void shouldRejectNegativeWeight() {
        assertThatThrownBy(() -> sampler.sample("bs1", new double[] {-0.5, 1.5}, 10, 1L))
                .isInstanceOf(SamplingException.class)
                .hasMessageContaining("negative weight");
    }

    @Test
    void shouldRejectEmptyWeights() {
        assertThatThrownBy(() -> sampler.sample("bs1", new double[0], 10, 1L))
                .isInstanceOf(SamplingException.class)
                .hasMessageContaining("no weights");
    }

    @Test
    void shouldRejectNonPositiveSampleCount() {
        assertThatThrownBy(() -> sampler.sample("bs1", new double[] {1.0}, 0, 1L))
                .isInstanceOf(SamplingException.class)
                .hasMessageContaining("must be positive");
    }
}
