package com.groomsafe.core;

/**
 * Raised at construction time when weights, multipliers or phrase rows are invalid.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
