package com.example.verification.processing;

import com.example.verification.aggregation.Accumulator;
import com.example.verification.aggregation.AccumulatorFactory;
import com.example.verification.aggregation.AccumulatorSet;
import com.example.verification.checkpoint.AccumulatorSnapshot;
import com.example.verification.checkpoint.CheckpointRecord;
import com.example.verification.checkpoint.CheckpointStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulators and completed chunk ids a run starts from.
 */
public record ResumePoint(AccumulatorSet accumulators, Set<String> completedChunkIds) {

    public ResumePoint {
        completedChunkIds = Set.copyOf(completedChunkIds);
    }

    public static ResumePoint fresh(AccumulatorFactory factory) {
        return new ResumePoint(new AccumulatorSet(factory), Set.of());
    }

    /**
     * Restores from the store, or starts fresh when nothing was saved yet.
     *
     * @throws com.example.verification.exception.CheckpointCorruptException if the snapshot is invalid;
     *         starting fresh instead is the caller's decision
     * @throws com.example.verification.exception.ConfigurationException if the snapshot was written
     *         with a different per-variable configuration
     */
    public static ResumePoint load(CheckpointStore store, AccumulatorFactory factory) throws IOException {
        Optional<CheckpointRecord> record = store.load();
        if (record.isEmpty()) {
            return fresh(factory);
        }
        List<Accumulator> restored = new ArrayList<>(record.get().accumulators().size());
        for (AccumulatorSnapshot snapshot : record.get().accumulators()) {
            restored.add(snapshot.toAccumulator());
        }
        return new ResumePoint(AccumulatorSet.restore(factory, restored), record.get().completedChunkIds());
    }
}
