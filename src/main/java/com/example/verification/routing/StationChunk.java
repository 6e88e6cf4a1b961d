package com.example.verification.routing;

import com.example.verification.model.AccumulatorId;
import com.example.verification.model.EntityKey;

import java.util.Map;
import java.util.Objects;

/**
 * Point observations for a set of stations, plus the forecast series of the
 * gridpoints they may map to.
 *
 * <p>Each station's observation series is paired with the forecast series of
 * its nearest gridpoint; both series must cover the same time steps.
 */
public record StationChunk(
        String chunkId,
        String variable,
        String group,
        Map<EntityKey, double[]> observationsByStation,
        Map<EntityKey, double[]> forecastsByGridpoint
) implements VerificationChunk {

    public StationChunk {
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        group = group != null ? group : AccumulatorId.DEFAULT_GROUP;
        observationsByStation = Map.copyOf(observationsByStation);
        forecastsByGridpoint = Map.copyOf(forecastsByGridpoint);
    }
}
