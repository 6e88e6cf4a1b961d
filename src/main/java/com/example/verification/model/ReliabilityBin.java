package com.example.verification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running totals for one probability bin of a reliability diagram.
 */
public record ReliabilityBin(
        double forecastProbabilitySum,
        long observedEventCount,
        long sampleCount
) {
    @JsonCreator
    public ReliabilityBin(
            @JsonProperty("forecastProbabilitySum") double forecastProbabilitySum,
            @JsonProperty("observedEventCount") long observedEventCount,
            @JsonProperty("sampleCount") long sampleCount
    ) {
        this.forecastProbabilitySum = forecastProbabilitySum;
        this.observedEventCount = observedEventCount;
        this.sampleCount = sampleCount;
    }

    public static ReliabilityBin zero() {
        return new ReliabilityBin(0.0, 0, 0);
    }

    public ReliabilityBin plus(ReliabilityBin other) {
        return new ReliabilityBin(
                forecastProbabilitySum + other.forecastProbabilitySum,
                observedEventCount + other.observedEventCount,
                sampleCount + other.sampleCount
        );
    }
}
