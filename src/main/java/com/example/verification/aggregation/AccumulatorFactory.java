package com.example.verification.aggregation;

import com.example.verification.exception.ConfigurationException;
import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorId;

import java.util.Map;

/**
 * Creates accumulators from an explicit per-variable configuration.
 *
 * <p>Configuration is passed in, never read from global state, so several
 * factories with different thresholds can be used side by side.
 */
public final class AccumulatorFactory {

    private final Map<String, AccumulatorConfig> configsByVariable;

    public AccumulatorFactory(Map<String, AccumulatorConfig> configsByVariable) {
        if (configsByVariable == null || configsByVariable.isEmpty()) {
            throw new ConfigurationException("at least one variable must be configured");
        }
        this.configsByVariable = Map.copyOf(configsByVariable);
    }

    public static AccumulatorFactory of(String variable, AccumulatorConfig config) {
        return new AccumulatorFactory(Map.of(variable, config));
    }

    /**
     * @throws ConfigurationException if the variable was not configured
     */
    public AccumulatorConfig configFor(String variable) {
        AccumulatorConfig config = configsByVariable.get(variable);
        if (config == null) {
            throw new ConfigurationException("no accumulator configuration for variable " + variable);
        }
        return config;
    }

    public Accumulator create(AccumulatorId id) {
        return new Accumulator(id, configFor(id.variable()));
    }
}
