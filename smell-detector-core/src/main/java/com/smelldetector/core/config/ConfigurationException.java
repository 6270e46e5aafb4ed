package com.smelldetector.core.config;

/**
 * Raised when analysis settings are invalid.
 *
 * <p>Signals caller misuse (negative threshold, unreadable config file), as opposed to a
 * property of the analysed code. Thrown at load or construction time, before any analysis runs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
