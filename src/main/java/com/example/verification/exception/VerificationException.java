package com.example.verification.exception;

/**
 * Base class for failures raised by the accumulation engine.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
