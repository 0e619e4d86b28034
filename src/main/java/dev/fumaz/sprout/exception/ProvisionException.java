package dev.fumaz.sprout.exception;

/**
 * Signals a failure raised by a constructor or factory while activating a service.
 */
public class ProvisionException extends SproutException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProvisionException(Throwable cause) {
        super(cause);
    }
}
