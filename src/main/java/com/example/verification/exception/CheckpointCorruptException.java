package com.example.verification.exception;

import java.io.IOException;

/**
 * Raised when a persisted checkpoint exists but cannot be trusted: bad checksum,
 * unreadable JSON, or a schema version with no migration path.
 *
 * <p>Resuming from scratch is left to the caller; the store never falls back
 * to an empty state on its own.
 */
public class CheckpointCorruptException extends IOException {

    public CheckpointCorruptException(String message) {
        super(message);
    }

    public CheckpointCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
