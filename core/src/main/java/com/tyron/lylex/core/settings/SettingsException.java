package com.tyron.lylex.core.settings;

/**
 * Thrown when a settings source cannot be read or parsed.
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
