package com.sweeper.exception;

/**
 * Invalid construction parameters: dimension mismatch, not enough free cells,
 * malformed persisted game. No partially built board escapes.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
