package com.example.verification.metrics;

import com.example.verification.model.AccumulatorId;
import com.example.verification.model.AccumulatorState;
import com.example.verification.model.ContingencyTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output row handed to storage: metric values plus the raw counts behind them,
 * so a reader can tell "no skill" from "no data".
 *
 * @param minSamples sample count the entity needed
 * @param sufficient true if {@code sample_count >= minSamples}
 */
public record MetricRecord(
        AccumulatorId id,
        Map<String, MetricValue> metrics,
        Map<String, Long> counts,
        long minSamples,
        boolean sufficient
) {
    public MetricRecord {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static MetricRecord of(VerificationMetrics derived, AccumulatorState state, long minSamples) {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("sample_count", state.getSampleCount());
        counts.put("missing_count", state.getMissingCount());
        for (CategoricalScores scores : derived.categorical()) {
            String suffix = "@" + scores.threshold();
            ContingencyTable table = scores.table();
            counts.put("hits" + suffix, table.hits());
            counts.put("misses" + suffix, table.misses());
            counts.put("false_alarms" + suffix, table.falseAlarms());
            counts.put("correct_negatives" + suffix, table.correctNegatives());
        }
        if (derived.probabilistic() != null) {
            counts.put("probability_sample_count", state.getProbabilitySampleCount());
            counts.put("observed_event_count", state.getObservedEventCount());
        }
        return new MetricRecord(derived.id(), derived.asMap(), counts,
                minSamples, state.getSampleCount() >= minSamples);
    }
}
