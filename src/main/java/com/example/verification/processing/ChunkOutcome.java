package com.example.verification.processing;

/**
 * What happened to one chunk.
 */
public enum ChunkOutcome {
    /** Pairs folded in and the chunk id recorded as completed. */
    APPLIED,
    /** Already in the completed set, nothing touched. */
    SKIPPED,
    /** Malformed batch, nothing touched and the chunk left pending. */
    REJECTED
}
