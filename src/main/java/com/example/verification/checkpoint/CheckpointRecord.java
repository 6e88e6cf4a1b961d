package com.example.verification.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Versioned snapshot of a run: every live accumulator and the ids of the
 * chunks already folded into them, no more and no less.
 *
 * @param schemaVersion layout version, see {@link CheckpointCodec#SCHEMA_VERSION}
 * @param sequenceNumber increases by one on every save of the same store
 * @param completedChunkIds chunks whose pairs are included, kept sorted
 * @param accumulators accumulator snapshots
 */
public record CheckpointRecord(
        int schemaVersion,
        long sequenceNumber,
        Set<String> completedChunkIds,
        List<AccumulatorSnapshot> accumulators
) {
    @JsonCreator
    public CheckpointRecord(
            @JsonProperty("schemaVersion") int schemaVersion,
            @JsonProperty("sequenceNumber") long sequenceNumber,
            @JsonProperty("completedChunkIds") Set<String> completedChunkIds,
            @JsonProperty("accumulators") List<AccumulatorSnapshot> accumulators
    ) {
        this.schemaVersion = schemaVersion;
        this.sequenceNumber = sequenceNumber;
        this.completedChunkIds = completedChunkIds != null
                ? Collections.unmodifiableSet(new TreeSet<>(completedChunkIds))
                : Set.of();
        this.accumulators = accumulators != null ? List.copyOf(accumulators) : List.of();
    }
}
