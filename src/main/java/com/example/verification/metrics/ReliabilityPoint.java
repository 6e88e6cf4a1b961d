package com.example.verification.metrics;

/**
 * One point of a reliability diagram. Both coordinates are undefined for an empty bin.
 */
public record ReliabilityPoint(
        double binLower,
        double binUpper,
        long sampleCount,
        MetricValue meanForecastProbability,
        MetricValue observedFrequency
) {
}
