package com.example.verification.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MetricValue, the defined-or-undefined metric result.
 */
class MetricValueTest {

    @Test
    @DisplayName("Should be undefined for a zero denominator")
    void shouldBeUndefinedForZeroDenominator() {
        assertThat(MetricValue.ratio(1.0, 0.0).isDefined()).isFalse();
        assertThat(MetricValue.ratio(0.0, 4.0).getAsDouble()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should turn non-finite numbers into undefined")
    void shouldTurnNonFiniteIntoUndefined() {
        assertThat(MetricValue.of(Double.NaN)).isEqualTo(MetricValue.undefined());
        assertThat(MetricValue.of(Double.POSITIVE_INFINITY)).isEqualTo(MetricValue.undefined());
        assertThat(MetricValue.undefined()).hasToString("undefined");
    }

    @Test
    @DisplayName("Should refuse to read an undefined value")
    void shouldRefuseToReadUndefined() {
        assertThatThrownBy(() -> MetricValue.undefined().getAsDouble())
                .isInstanceOf(IllegalStateException.class);
        assertThat(MetricValue.undefined().orElse(-1.0)).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("Should map defined values only")
    void shouldMapDefinedValuesOnly() {
        assertThat(MetricValue.of(4.0).map(Math::sqrt)).isEqualTo(MetricValue.of(2.0));
        assertThat(MetricValue.undefined().map(Math::sqrt).isDefined()).isFalse();
    }

    /**
     * Undefined values are written as JSON null and read back as undefined.
     */
    @Test
    @DisplayName("Should serialize undefined as JSON null")
    void shouldSerializeUndefinedAsNull() throws Exception {
        // Given
        ObjectMapper mapper = new ObjectMapper();

        // When
        String defined = mapper.writeValueAsString(MetricValue.of(0.5));
        String undefined = mapper.writeValueAsString(MetricValue.undefined());

        // Then
        assertThat(defined).isEqualTo("0.5");
        assertThat(undefined).isEqualTo("null");
        assertThat(mapper.readValue("0.25", MetricValue.class)).isEqualTo(MetricValue.of(0.25));
    }
}
