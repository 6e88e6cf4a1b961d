package com.example.verification.exception;

/**
 * Raised when an accumulator or the engine is set up inconsistently.
 */
public class ConfigurationException extends VerificationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
