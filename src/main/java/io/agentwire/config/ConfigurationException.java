package io.agentwire.config;

/**
 * Missing or invalid agent settings. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
