package dev.fumaz.sprout.exception;

/**
 * Indicates a misconfiguration of the container, detected while registering services or while building the provider.
 */
public class ConfigurationException extends SproutException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }
}
