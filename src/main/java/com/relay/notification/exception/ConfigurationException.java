package com.relay.notification.exception;

/**
 * Invalid construction parameters. Never corrected silently.
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
