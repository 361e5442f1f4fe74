package com.kafcat.core.error;

/**
 * Invalid or unsupported configuration. Raised before any connection is attempted.
 */
public class ConfigurationException extends KafcatException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
