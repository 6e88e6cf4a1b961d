package com.example.verification.metrics;

import com.example.verification.model.ContingencyTable;

/**
 * Scores derived from the contingency table of one threshold.
 *
 * @param threshold event threshold, event means {@code value >= threshold}
 * @param table the raw tallies
 * @param hitRate hits / (hits + misses)
 * @param falseAlarmRatio false alarms / (hits + false alarms)
 * @param criticalSuccessIndex hits / (hits + misses + false alarms)
 * @param falseAlarmRate false alarms / (false alarms + correct negatives)
 * @param frequencyBias (hits + false alarms) / (hits + misses)
 */
public record CategoricalScores(
        double threshold,
        ContingencyTable table,
        MetricValue hitRate,
        MetricValue falseAlarmRatio,
        MetricValue criticalSuccessIndex,
        MetricValue falseAlarmRate,
        MetricValue frequencyBias
) {
    public static CategoricalScores from(double threshold, ContingencyTable table) {
        long hits = table.hits();
        long misses = table.misses();
        long falseAlarms = table.falseAlarms();
        long correctNegatives = table.correctNegatives();
        return new CategoricalScores(
                threshold,
                table,
                MetricValue.ratio(hits, hits + misses),
                MetricValue.ratio(falseAlarms, hits + falseAlarms),
                MetricValue.ratio(hits, hits + misses + falseAlarms),
                MetricValue.ratio(falseAlarms, falseAlarms + correctNegatives),
                MetricValue.ratio(hits + falseAlarms, hits + misses)
        );
    }
}
