package dev.fumaz.sprout.reflection;

import dev.fumaz.sprout.exception.ConfigurationException;

public class ReflectionException extends ConfigurationException {

    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
