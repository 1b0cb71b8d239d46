package io.fullerstack.workqueue.config;

/**
 * Thrown when a required configuration key is missing or holds an unparseable value.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
