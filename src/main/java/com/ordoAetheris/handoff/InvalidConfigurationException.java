package com.ordoAetheris.handoff;

/**
 * Rejected setup (capacity below 1, malformed settings). Raised before any thread is started.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
