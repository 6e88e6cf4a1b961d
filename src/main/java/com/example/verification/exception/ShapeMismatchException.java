package com.example.verification.exception;

/**
 * Raised when the arrays of one batch are not aligned.
 *
 * <p>The batch is rejected as a whole and no state is touched, so callers may
 * skip the chunk and carry on.
 */
public class ShapeMismatchException extends VerificationException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ShapeMismatchException lengths(String what, int expected, int actual) {
        return new ShapeMismatchException(
                what + " has length " + actual + " but " + expected + " was expected");
    }
}
