package com.example.verification.qc;

import com.example.verification.metrics.MetricValue;
import com.example.verification.model.AccumulatorId;

/**
 * Sample sufficiency of one accumulator.
 *
 * @param completeness share of valid pairs among all pairs seen, undefined when none were seen
 */
public record CompletenessResult(
        AccumulatorId id,
        long sampleCount,
        long missingCount,
        long minSamples,
        boolean sufficient,
        MetricValue completeness
) {
}
