package com.example.verification.processing;

import com.example.verification.aggregation.AccumulatorSet;
import com.example.verification.qc.CompletenessReport;

import java.util.Set;

/**
 * Outcome of a run.
 *
 * @param accumulators final accumulators, including those restored from a checkpoint
 * @param completedChunkIds every chunk folded in, restored ones included
 * @param applied chunks applied in this run
 * @param skipped chunks skipped because a checkpoint already covered them
 * @param rejected malformed chunks left pending
 * @param stopped true if the run stopped early on request
 * @param checkpointSequence sequence of the last checkpoint written, 0 if none
 * @param completeness accumulators below their minimum sample count, empty when the run stopped early
 */
public record RunResult(
        AccumulatorSet accumulators,
        Set<String> completedChunkIds,
        int applied,
        int skipped,
        int rejected,
        boolean stopped,
        long checkpointSequence,
        CompletenessReport completeness
) {
    public RunResult {
        completedChunkIds = Set.copyOf(completedChunkIds);
    }
}
