package dev.fumaz.sprout.exception;

/**
 * Thrown when an alias operation is attempted on a container running in strict mode.
 */
public class InvalidOperationInStrictModeException extends ConfigurationException {

    public InvalidOperationInStrictModeException() {
        super("The services are configured in strict mode, the operation is invalid.");
    }
}
