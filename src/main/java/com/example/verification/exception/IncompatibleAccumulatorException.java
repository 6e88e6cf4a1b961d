package com.example.verification.exception;

/**
 * Raised when two accumulators with different identity or configuration are
 * asked to merge. This always points at a broken run and is never resolved
 * automatically.
 */
public class IncompatibleAccumulatorException extends VerificationException {

    public IncompatibleAccumulatorException(String message) {
        super(message);
    }
}
