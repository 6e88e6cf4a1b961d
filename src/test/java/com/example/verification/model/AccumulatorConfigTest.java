package com.example.verification.model;

import com.example.verification.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AccumulatorConfig and ProbabilityBins.
 */
class AccumulatorConfigTest {

    // =========================================================================
    // NORMALIZATION
    // =========================================================================

    @Test
    @DisplayName("Should sort and de-duplicate thresholds")
    void shouldNormalizeThresholds() {
        AccumulatorConfig config = AccumulatorConfig.continuous().withThresholds(3.0, 1.0, 3.0);

        assertThat(config.thresholds()).containsExactly(1.0, 3.0);
        assertThat(config).isEqualTo(AccumulatorConfig.continuous().withThresholds(1.0, 3.0));
    }

    @Test
    @DisplayName("Should default to the REJECT policy")
    void shouldDefaultToRejectPolicy() {
        AccumulatorConfig config = new AccumulatorConfig(null, null, null, null, null);

        assertThat(config.probabilityPolicy()).isEqualTo(ProbabilityPolicy.REJECT);
        assertThat(config.thresholds()).isEmpty();
        assertThat(config.hasProbabilities()).isFalse();
        assertThat(config.binCount()).isZero();
    }

    @Test
    @DisplayName("Should treat non-finite values and the sentinel as missing")
    void shouldRecognizeMissingValues() {
        AccumulatorConfig config = AccumulatorConfig.continuous().withMissingValue(-999.0);

        assertThat(config.isMissing(Double.NaN)).isTrue();
        assertThat(config.isMissing(Double.NEGATIVE_INFINITY)).isTrue();
        assertThat(config.isMissing(-999.0)).isTrue();
        assertThat(config.isMissing(0.0)).isFalse();
        assertThat(AccumulatorConfig.continuous().isMissing(-999.0)).isFalse();
    }

    // =========================================================================
    // VALIDATION
    // =========================================================================

    @Test
    @DisplayName("Should reject non-finite thresholds")
    void shouldRejectNonFiniteThresholds() {
        assertThatThrownBy(() -> AccumulatorConfig.continuous().withThresholds(1.0, Double.NaN))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should require an event threshold when bins are configured")
    void shouldRequireEventThreshold() {
        assertThatThrownBy(() -> new AccumulatorConfig(null, ProbabilityBins.deciles(), null, null, null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("event threshold");
    }

    @Test
    @DisplayName("Should reject a bin count below one")
    void shouldRejectEmptyBins() {
        assertThatThrownBy(() -> new ProbabilityBins(0))
                .isInstanceOf(ConfigurationException.class);
    }

    // =========================================================================
    // BINS
    // =========================================================================

    @Test
    @DisplayName("Should place probabilities into equal-width bins")
    void shouldPlaceProbabilitiesIntoBins() {
        ProbabilityBins bins = ProbabilityBins.deciles();

        int[] indexes = Arrays.stream(new double[]{0.0, 0.05, 0.1, 0.55, 0.99, 1.0})
                .mapToInt(bins::indexOf)
                .toArray();

        assertThat(indexes).containsExactly(0, 0, 1, 5, 9, 9);
        assertThat(bins.lowerEdge(5)).isEqualTo(0.5);
        assertThat(bins.upperEdge(9)).isEqualTo(1.0);
    }
}
