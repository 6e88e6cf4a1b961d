package com.example.verification.qc;

import com.example.verification.aggregation.Accumulator;
import com.example.verification.metrics.MetricValue;
import com.example.verification.model.CompletenessPolicy;
import com.example.verification.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags accumulators whose sample count is below the policy minimum for their
 * entity kind.
 *
 * <p>Example usage:
 * <pre>{@code
 * CompletenessReport report = new CompletenessCheck(CompletenessPolicy.defaults())
 *         .checkAll(result.accumulators());
 * if (!report.isComplete()) {
 *     report.insufficient().forEach(r -> flag(r.id()));
 * }
 * }</pre>
 */
public class CompletenessCheck {

    private static final Logger log = LoggerFactory.getLogger(CompletenessCheck.class);

    /** Entities named in one summary line. */
    private static final int LOGGED_EXAMPLES = 10;

    private final CompletenessPolicy policy;

    public CompletenessCheck(CompletenessPolicy policy) {
        this.policy = policy;
    }

    public CompletenessResult check(Accumulator accumulator) {
        long samples = accumulator.sampleCount();
        long missing = accumulator.missingCount();
        long minSamples = policy.minSamplesFor(accumulator.id().kind());
        return new CompletenessResult(accumulator.id(), samples, missing, minSamples,
                samples >= minSamples, MetricValue.ratio(samples, samples + missing));
    }

    /**
     * Checks every accumulator and logs one warning per entity kind that has
     * insufficient entities.
     */
    public CompletenessReport checkAll(Iterable<Accumulator> accumulators) {
        int checked = 0;
        List<CompletenessResult> insufficient = new ArrayList<>();
        for (Accumulator accumulator : accumulators) {
            checked++;
            CompletenessResult result = check(accumulator);
            if (!result.sufficient()) {
                log.debug("completeness.insufficient id={} samples={} min={}",
                        result.id(), result.sampleCount(), result.minSamples());
                insufficient.add(result);
            }
        }
        CompletenessReport report = new CompletenessReport(checked, insufficient);
        for (EntityKind kind : EntityKind.values()) {
            long count = report.insufficientCount(kind);
            if (count > 0) {
                log.warn("completeness.insufficient kind={} count={} min={} examples={}",
                        kind, count, policy.minSamplesFor(kind), examples(insufficient, kind));
            }
        }
        return report;
    }

    private static List<String> examples(List<CompletenessResult> insufficient, EntityKind kind) {
        List<String> examples = new ArrayList<>(LOGGED_EXAMPLES);
        for (CompletenessResult result : insufficient) {
            if (result.id().kind() == kind && examples.size() < LOGGED_EXAMPLES) {
                examples.add(result.id() + "(" + result.sampleCount() + ")");
            }
        }
        return examples;
    }
}
