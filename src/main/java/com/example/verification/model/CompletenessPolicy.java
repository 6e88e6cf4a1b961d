package com.example.verification.model;

import com.example.verification.exception.ConfigurationException;

/**
 * Minimum number of valid pairs an entity needs before its metrics are
 * considered trustworthy, per entity kind.
 *
 * <p>Regions pool many gridpoints, so they get the highest bar; a single
 * gridpoint only sees one value per time step.
 */
public record CompletenessPolicy(
        long gridpointMinSamples,
        long regionMinSamples,
        long stationMinSamples
) {
    public static final long DEFAULT_GRIDPOINT_MIN_SAMPLES = 5;
    public static final long DEFAULT_REGION_MIN_SAMPLES = 50;
    public static final long DEFAULT_STATION_MIN_SAMPLES = 10;

    public CompletenessPolicy {
        if (gridpointMinSamples < 0 || regionMinSamples < 0 || stationMinSamples < 0) {
            throw new ConfigurationException("minimum sample counts must be >= 0, got "
                    + gridpointMinSamples + "/" + regionMinSamples + "/" + stationMinSamples);
        }
    }

    public static CompletenessPolicy defaults() {
        return new CompletenessPolicy(
                DEFAULT_GRIDPOINT_MIN_SAMPLES, DEFAULT_REGION_MIN_SAMPLES, DEFAULT_STATION_MIN_SAMPLES);
    }

    /**
     * Policy that accepts any sample count, including zero.
     */
    public static CompletenessPolicy none() {
        return new CompletenessPolicy(0, 0, 0);
    }

    public long minSamplesFor(EntityKind kind) {
        return switch (kind) {
            case GRIDPOINT -> gridpointMinSamples;
            case REGION -> regionMinSamples;
            case STATION -> stationMinSamples;
        };
    }

    public boolean isSufficient(EntityKind kind, long sampleCount) {
        return sampleCount >= minSamplesFor(kind);
    }
}
