package com.example.verification.routing;

/**
 * A bounded slice of paired data processed in one pass.
 *
 * <p>Chunk ids must be stable across runs: the checkpoint records them to
 * decide which chunks a resumed run can skip.
 */
public interface VerificationChunk {

    String chunkId();

    String variable();

    /**
     * Temporal group the pairs belong to, see {@link com.example.verification.model.AccumulatorId#group()}.
     */
    String group();
}
