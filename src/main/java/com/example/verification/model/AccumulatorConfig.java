package com.example.verification.model;

import com.example.verification.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable statistics configuration frozen into an accumulator at construction.
 *
 * <p>Two accumulators can only be merged when their configurations are equal.
 * Thresholds are normalized (sorted, de-duplicated) so that the order in which
 * a caller lists them never makes two otherwise identical setups incompatible.
 *
 * <pre>{@code
 * AccumulatorConfig tmp = AccumulatorConfig.continuous()
 *         .withThresholds(273.15, 283.15)
 *         .withMissingValue(9999.0);
 *
 * AccumulatorConfig pop = AccumulatorConfig.continuous()
 *         .withProbabilities(ProbabilityBins.deciles(), 0.254);
 * }</pre>
 *
 * @param thresholds categorical event thresholds, event means {@code value >= t}
 * @param probabilityBins reliability bins, or {@code null} when no probabilities are verified
 * @param eventThreshold observation threshold defining the probabilistic event
 * @param probabilityPolicy handling of probabilities outside [0, 1]
 * @param missingValue sentinel marking missing data in addition to non-finite values, may be {@code null}
 */
public record AccumulatorConfig(
        List<Double> thresholds,
        ProbabilityBins probabilityBins,
        Double eventThreshold,
        ProbabilityPolicy probabilityPolicy,
        Double missingValue
) {
    @JsonCreator
    public AccumulatorConfig(
            @JsonProperty("thresholds") List<Double> thresholds,
            @JsonProperty("probabilityBins") ProbabilityBins probabilityBins,
            @JsonProperty("eventThreshold") Double eventThreshold,
            @JsonProperty("probabilityPolicy") ProbabilityPolicy probabilityPolicy,
            @JsonProperty("missingValue") Double missingValue
    ) {
        this.thresholds = normalize(thresholds);
        this.probabilityBins = probabilityBins;
        this.eventThreshold = eventThreshold;
        this.probabilityPolicy = probabilityPolicy != null ? probabilityPolicy : ProbabilityPolicy.REJECT;
        this.missingValue = missingValue;

        if (probabilityBins != null && eventThreshold == null) {
            throw new ConfigurationException("probability bins require an event threshold");
        }
        if (eventThreshold != null && !Double.isFinite(eventThreshold)) {
            throw new ConfigurationException("event threshold must be finite, got " + eventThreshold);
        }
    }

    /**
     * Configuration with continuous statistics only.
     */
    public static AccumulatorConfig continuous() {
        return new AccumulatorConfig(List.of(), null, null, ProbabilityPolicy.REJECT, null);
    }

    public AccumulatorConfig withThresholds(double... values) {
        List<Double> list = Arrays.stream(values).boxed().toList();
        return new AccumulatorConfig(list, probabilityBins, eventThreshold, probabilityPolicy, missingValue);
    }

    public AccumulatorConfig withProbabilities(ProbabilityBins bins, double threshold) {
        return new AccumulatorConfig(thresholds, bins, threshold, probabilityPolicy, missingValue);
    }

    public AccumulatorConfig withProbabilityPolicy(ProbabilityPolicy policy) {
        return new AccumulatorConfig(thresholds, probabilityBins, eventThreshold, policy, missingValue);
    }

    public AccumulatorConfig withMissingValue(double sentinel) {
        return new AccumulatorConfig(thresholds, probabilityBins, eventThreshold, probabilityPolicy, sentinel);
    }

    @JsonIgnore
    public boolean hasProbabilities() {
        return probabilityBins != null;
    }

    @JsonIgnore
    public int binCount() {
        return probabilityBins != null ? probabilityBins.count() : 0;
    }

    /**
     * Returns true if the value must be treated as absent.
     */
    public boolean isMissing(double value) {
        return !Double.isFinite(value) || (missingValue != null && value == missingValue);
    }

    private static List<Double> normalize(List<Double> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            return List.of();
        }
        for (Double t : thresholds) {
            if (t == null || !Double.isFinite(t)) {
                throw new ConfigurationException("thresholds must be finite numbers, got " + thresholds);
            }
        }
        return thresholds.stream().distinct().sorted().toList();
    }
}
