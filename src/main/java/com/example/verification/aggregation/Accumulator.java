package com.example.verification.aggregation;

import com.example.verification.exception.ConfigurationException;
import com.example.verification.exception.IncompatibleAccumulatorException;
import com.example.verification.kernel.BatchContribution;
import com.example.verification.kernel.StatisticKernels;
import com.example.verification.metrics.MetricRecord;
import com.example.verification.metrics.VerificationMetrics;
import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.AccumulatorState;
import com.example.verification.model.CompletenessPolicy;

import java.util.Objects;

/**
 * Running sufficient statistics for one (entity, variable, group).
 *
 * <p>This is the atomic mergeable unit. Gridpoint, regional and station
 * accumulators are all this one type; the entity kind lives in the
 * {@link AccumulatorId}. Memory is constant in the number of pairs folded in:
 * only the {@link AccumulatorState} is kept, never the pairs.
 *
 * <p>Example usage:
 * <pre>{@code
 * Accumulator acc = new Accumulator(
 *         AccumulatorId.of(EntityKey.gridpoint(0, 0, 40.0, -100.0), "TMP_2m"),
 *         AccumulatorConfig.continuous().withThresholds(273.15));
 *
 * acc.update(forecasts, observations);   // once per chunk
 * VerificationMetrics metrics = acc.computeMetrics();
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. Each worker must own
 * its accumulators; combine workers through {@link Merger}.
 */
public final class Accumulator {

    private final AccumulatorId id;
    private final AccumulatorConfig config;
    private final AccumulatorState state;

    /**
     * Creates an accumulator in the identity (all-zero) state.
     */
    public Accumulator(AccumulatorId id, AccumulatorConfig config) {
        this(id, config, AccumulatorState.empty(config));
    }

    private Accumulator(AccumulatorId id, AccumulatorConfig config, AccumulatorState state) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.state = state;
    }

    /**
     * Rebuilds an accumulator from persisted state.
     *
     * @throws ConfigurationException if the state's table/bin layout does not match the configuration
     */
    public static Accumulator restore(AccumulatorId id, AccumulatorConfig config, AccumulatorState state) {
        if (!state.hasShapeOf(config)) {
            throw new ConfigurationException("state of " + id + " does not match its configuration");
        }
        return new Accumulator(id, config, state.copy());
    }

    /**
     * Folds a batch of forecast/observation pairs into the running state.
     *
     * @see #update(double[], double[], double[])
     */
    public UpdateResult update(double[] forecasts, double[] observations) {
        return update(forecasts, observations, null);
    }

    /**
     * Folds a batch into the running state. The batch is validated before
     * anything is touched, so a rejected batch leaves the state unchanged.
     *
     * @param forecasts forecast values
     * @param observations observation values aligned with {@code forecasts}
     * @param probabilities event probabilities aligned with {@code forecasts}, or {@code null}
     * @return accepted and rejected pair counts
     * @throws com.example.verification.exception.ShapeMismatchException if lengths disagree
     * @throws ConfigurationException if probabilities are given but no bins are configured
     */
    public UpdateResult update(double[] forecasts, double[] observations, double[] probabilities) {
        BatchContribution contribution = StatisticKernels.contribute(config, forecasts, observations, probabilities);
        state.add(contribution.delta());
        return new UpdateResult(contribution.accepted(), contribution.rejected());
    }

    /**
     * Returns a new accumulator holding the statistics of both sides; neither
     * input is modified.
     *
     * @throws IncompatibleAccumulatorException if identity or configuration differ
     */
    public Accumulator merge(Accumulator other) {
        requireCompatible(other);
        return new Accumulator(id, config, state.combine(other.state));
    }

    /**
     * Folds another accumulator into this one (accepting side).
     *
     * @return this accumulator
     * @throws IncompatibleAccumulatorException if identity or configuration differ
     */
    public Accumulator absorb(Accumulator other) {
        requireCompatible(other);
        state.add(other.state);
        return this;
    }

    public boolean isCompatibleWith(Accumulator other) {
        return id.equals(other.id) && config.equals(other.config);
    }

    private void requireCompatible(Accumulator other) {
        if (!id.equals(other.id)) {
            throw new IncompatibleAccumulatorException(
                    "cannot merge " + id + " with " + other.id);
        }
        if (!config.equals(other.config)) {
            throw new IncompatibleAccumulatorException(
                    "configuration of " + id + " differs: " + config + " vs " + other.config);
        }
    }

    /**
     * Derives metrics from the current state. Side-effect free and callable any
     * number of times.
     */
    public VerificationMetrics computeMetrics() {
        return VerificationMetrics.derive(id, config, state);
    }

    /**
     * Metrics plus raw counts, ready for an output writer. No minimum sample
     * count applies, so the record is always flagged sufficient.
     */
    public MetricRecord toRecord() {
        return toRecord(CompletenessPolicy.none());
    }

    /**
     * Metrics plus raw counts, flagged sufficient when the sample count reaches
     * the policy's minimum for this entity kind.
     */
    public MetricRecord toRecord(CompletenessPolicy policy) {
        return MetricRecord.of(computeMetrics(), state, policy.minSamplesFor(id.kind()));
    }

    /**
     * Returns a deep copy; later updates to either side stay independent.
     */
    public Accumulator copy() {
        return new Accumulator(id, config, state.copy());
    }

    public AccumulatorId id() {
        return id;
    }

    public AccumulatorConfig config() {
        return config;
    }

    /**
     * Returns a copy of the current state.
     */
    public AccumulatorState state() {
        return state.copy();
    }

    public long sampleCount() {
        return state.getSampleCount();
    }

    public long missingCount() {
        return state.getMissingCount();
    }

    @Override
    public String toString() {
        return "Accumulator{" + id + ", " + state + "}";
    }
}
