package com.example.verification.checkpoint;

import com.example.verification.aggregation.Accumulator;

import java.io.IOException;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Persists the full accumulator set of a run plus its progress cursor.
 *
 * <p>Callers must quiesce all workers before {@link #save}: no update may be in
 * flight against an accumulator that is being snapshotted.
 */
public interface CheckpointStore {

    /**
     * Replaces the stored snapshot with a new one.
     *
     * @param accumulators every live accumulator
     * @param completedChunkIds ids of all chunks folded into them
     * @return the sequence number of the new snapshot
     * @throws IOException if the snapshot could not be written; the previous one is then kept
     */
    long save(Collection<Accumulator> accumulators, Set<String> completedChunkIds) throws IOException;

    /**
     * Returns the latest snapshot, or empty if none was ever saved.
     *
     * @throws com.example.verification.exception.CheckpointCorruptException if a snapshot exists but fails validation
     * @throws IOException if the snapshot could not be read
     */
    Optional<CheckpointRecord> load() throws IOException;

    boolean exists();

    /**
     * Removes the stored snapshot, if any.
     */
    void delete() throws IOException;
}
