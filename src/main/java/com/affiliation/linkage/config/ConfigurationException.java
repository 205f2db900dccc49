package com.affiliation.linkage.config;

/**
 * Thrown when pipeline configuration is missing, unreadable or invalid.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
