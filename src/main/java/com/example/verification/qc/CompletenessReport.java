package com.example.verification.qc;

import com.example.verification.metrics.MetricValue;
import com.example.verification.model.EntityKind;

import java.util.List;

/**
 * Outcome of checking a set of accumulators: how many were checked and which
 * of them fell short. The sample statistics describe the insufficient entities only.
 */
public record CompletenessReport(
        int checked,
        List<CompletenessResult> insufficient
) {
    public CompletenessReport {
        insufficient = List.copyOf(insufficient);
    }

    public static CompletenessReport empty() {
        return new CompletenessReport(0, List.of());
    }

    public boolean isComplete() {
        return insufficient.isEmpty();
    }

    public int insufficientCount() {
        return insufficient.size();
    }

    public long insufficientCount(EntityKind kind) {
        return insufficient.stream().filter(result -> result.id().kind() == kind).count();
    }

    public long minSamplesFound() {
        return insufficient.stream().mapToLong(CompletenessResult::sampleCount).min().orElse(0);
    }

    public long maxSamplesFound() {
        return insufficient.stream().mapToLong(CompletenessResult::sampleCount).max().orElse(0);
    }

    public MetricValue meanSamples() {
        long total = insufficient.stream().mapToLong(CompletenessResult::sampleCount).sum();
        return MetricValue.ratio(total, insufficient.size());
    }
}
