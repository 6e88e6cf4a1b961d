package com.example.verification.checkpoint;

import com.example.verification.aggregation.Accumulator;
import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.AccumulatorState;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Persisted form of one accumulator: identity (entity kind and key, variable,
 * group), frozen configuration (thresholds, bins) and state fields.
 */
public record AccumulatorSnapshot(
        AccumulatorId id,
        AccumulatorConfig config,
        AccumulatorState state
) {
    @JsonCreator
    public AccumulatorSnapshot(
            @JsonProperty("id") AccumulatorId id,
            @JsonProperty("config") AccumulatorConfig config,
            @JsonProperty("state") AccumulatorState state
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    public static AccumulatorSnapshot of(Accumulator accumulator) {
        return new AccumulatorSnapshot(accumulator.id(), accumulator.config(), accumulator.state());
    }

    /**
     * @throws com.example.verification.exception.ConfigurationException if the state does not fit the configuration
     */
    public Accumulator toAccumulator() {
        return Accumulator.restore(id, config, state);
    }
}
