package dev.fumaz.sprout.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a factory does not follow any of the supported calling conventions.
 */
public class InvalidFactoryException extends ConfigurationException {

    public InvalidFactoryException(@Nullable Class<?> type) {
        super("The factory specified for type " + (type == null ? "<unknown>" : type.getSimpleName())
                + " is not valid, it must take either no parameters, (ActivationScope), "
                + "or (ActivationScope, Class<?>).");
    }
}
