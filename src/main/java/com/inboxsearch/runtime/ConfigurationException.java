package com.inboxsearch.runtime;

/**
 * Invalid configuration or invalid operation parameters. Never retried.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
