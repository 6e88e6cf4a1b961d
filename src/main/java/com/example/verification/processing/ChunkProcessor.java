package com.example.verification.processing;

import com.example.verification.aggregation.AccumulatorSet;
import com.example.verification.exception.ShapeMismatchException;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.EntityKey;
import com.example.verification.routing.ChunkRouter;
import com.example.verification.routing.GridChunk;
import com.example.verification.routing.RoutingPlan;
import com.example.verification.routing.StationChunk;
import com.example.verification.routing.VerificationChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds chunks into one worker's accumulators.
 *
 * <p>Grid chunks update one gridpoint accumulator per cell and every regional
 * accumulator containing that cell; station chunks update one station
 * accumulator per station, paired with the forecast at its nearest gridpoint.
 *
 * <p>A chunk is either applied in full and recorded as completed, or not
 * applied at all: every shape check runs before the first update. Chunks
 * already in the completed set are skipped, which is what makes resuming
 * from a checkpoint equivalent to an uninterrupted run.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 */
public final class ChunkProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChunkProcessor.class);

    private final ChunkRouter router;
    private final AccumulatorSet accumulators;
    private final Set<String> completedChunkIds;
    private long stationsWithoutGridpoint;

    public ChunkProcessor(ChunkRouter router, AccumulatorSet accumulators) {
        this(router, accumulators, Set.of());
    }

    public ChunkProcessor(ChunkRouter router, AccumulatorSet accumulators, Set<String> completedChunkIds) {
        this.router = router;
        this.accumulators = accumulators;
        this.completedChunkIds = new LinkedHashSet<>(completedChunkIds);
    }

    /**
     * Processes one chunk.
     *
     * @return whether the chunk was applied, skipped or rejected
     * @throws com.example.verification.exception.ConfigurationException if the chunk's variable is not
     *         configured or carries probabilities its accumulators cannot take
     */
    public ChunkOutcome process(VerificationChunk chunk) {
        if (completedChunkIds.contains(chunk.chunkId())) {
            log.debug("chunk.skipped id={}", chunk.chunkId());
            return ChunkOutcome.SKIPPED;
        }
        try {
            if (chunk instanceof GridChunk) {
                applyGrid((GridChunk) chunk);
            } else if (chunk instanceof StationChunk) {
                applyStations((StationChunk) chunk);
            } else {
                throw new IllegalArgumentException("unsupported chunk type " + chunk.getClass().getName());
            }
        } catch (ShapeMismatchException e) {
            log.warn("chunk.rejected id={} reason={}", chunk.chunkId(), e.getMessage());
            return ChunkOutcome.REJECTED;
        }
        completedChunkIds.add(chunk.chunkId());
        return ChunkOutcome.APPLIED;
    }

    private void applyGrid(GridChunk chunk) {
        chunk.validate();
        RoutingPlan plan = router.route(chunk.range());
        List<EntityKey> gridpoints = plan.gridpoints();
        for (int cell = 0; cell < gridpoints.size(); cell++) {
            EntityKey gridpoint = gridpoints.get(cell);
            double[] forecasts = chunk.forecastSeries(cell);
            double[] observations = chunk.observationSeries(cell);
            double[] probabilities = chunk.probabilitySeries(cell);

            accumulators.getOrCreate(AccumulatorId.of(gridpoint, chunk.variable(), chunk.group()))
                    .update(forecasts, observations, probabilities);
            for (EntityKey region : plan.regionsFor(gridpoint)) {
                accumulators.getOrCreate(AccumulatorId.of(region, chunk.variable(), chunk.group()))
                        .update(forecasts, observations, probabilities);
            }
        }
    }

    private void applyStations(StationChunk chunk) {
        List<StationPairs> pairs = new ArrayList<>();
        for (Map.Entry<EntityKey, double[]> entry : chunk.observationsByStation().entrySet()) {
            EntityKey station = entry.getKey();
            Optional<EntityKey> gridpoint = router.gridpointForStation(station);
            if (gridpoint.isEmpty()) {
                stationsWithoutGridpoint++;
                log.warn("station.unmapped chunk={} station={}", chunk.chunkId(), station.id());
                continue;
            }
            double[] forecasts = chunk.forecastsByGridpoint().get(gridpoint.get());
            double[] observations = entry.getValue();
            if (forecasts == null) {
                throw new ShapeMismatchException(
                        "chunk " + chunk.chunkId() + " has no forecast series for " + gridpoint.get());
            }
            if (forecasts.length != observations.length) {
                throw ShapeMismatchException.lengths(
                        "observations of " + station.id(), forecasts.length, observations.length);
            }
            pairs.add(new StationPairs(station, forecasts, observations));
        }

        for (StationPairs pair : pairs) {
            accumulators.getOrCreate(AccumulatorId.of(pair.station(), chunk.variable(), chunk.group()))
                    .update(pair.forecasts(), pair.observations());
        }
    }

    private record StationPairs(EntityKey station, double[] forecasts, double[] observations) {
    }

    public AccumulatorSet accumulators() {
        return accumulators;
    }

    public Set<String> completedChunkIds() {
        return Collections.unmodifiableSet(completedChunkIds);
    }

    /**
     * Stations skipped so far because the spatial index had no gridpoint for them.
     */
    public long stationsWithoutGridpoint() {
        return stationsWithoutGridpoint;
    }
}
