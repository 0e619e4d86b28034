package dev.fumaz.sprout.exception;

/**
 * Base unchecked exception for Sprout-specific failures.
 */
public class SproutException extends RuntimeException {

    public SproutException(String message) {
        super(message);
    }

    public SproutException(String message, Throwable cause) {
        super(message, cause);
    }

    public SproutException(Throwable cause) {
        super(cause);
    }
}
