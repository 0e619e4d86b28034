package dev.fumaz.sprout.exception;

/**
 * Thrown when a factory is registered without a return type and none can be inferred.
 */
public class MissingTypeException extends ConfigurationException {

    public MissingTypeException() {
        super("Please specify the factory return type, or use a factory method declaring a non-void return type.");
    }
}
