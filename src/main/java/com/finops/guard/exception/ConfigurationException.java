package com.finops.guard.exception;

/**
 * Raised when pipeline configuration is missing or malformed.
 * Thrown during context startup so that no stage ever runs with bad settings.
 */
public class ConfigurationException extends RuntimeException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super(property + ": " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
