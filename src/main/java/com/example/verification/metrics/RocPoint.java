package com.example.verification.metrics;

/**
 * One point of a ROC curve built from binned probabilities: a forecast counts
 * as "yes" when its bin starts at or above {@code probabilityThreshold}.
 */
public record RocPoint(
        double probabilityThreshold,
        MetricValue hitRate,
        MetricValue falseAlarmRate
) {
}
