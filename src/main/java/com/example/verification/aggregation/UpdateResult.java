package com.example.verification.aggregation;

/**
 * Diagnostics of one {@link Accumulator#update} call.
 */
public record UpdateResult(long accepted, long rejected) {

    public static UpdateResult none() {
        return new UpdateResult(0, 0);
    }

    public UpdateResult plus(UpdateResult other) {
        return new UpdateResult(accepted + other.accepted, rejected + other.rejected);
    }
}
