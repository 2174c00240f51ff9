package com.groomsafe.core;

/**
 * Raised when an input conversation or message is rejected before scoring.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
