package io.fullerstack.uptime.core.config;

/**
 * Exception thrown when the run configuration or the target list is missing or malformed.
 * <p>
 * Fatal for a run: nothing is probed once this is raised.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
