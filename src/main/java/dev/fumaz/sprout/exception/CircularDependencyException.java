package dev.fumaz.sprout.exception;

import dev.fumaz.sprout.bind.ServiceKeys;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a service depends, directly or transitively, on itself.
 */
public class CircularDependencyException extends ConfigurationException {

    private final @NotNull Class<?> expectedType;
    private final @NotNull Class<?> desiredType;
    private final @NotNull List<Class<?>> path;

    public CircularDependencyException(@NotNull Class<?> expectedType,
                                       @NotNull Class<?> desiredType,
                                       @NotNull List<Class<?>> path) {
        super(message(expectedType, desiredType, path));
        this.expectedType = expectedType;
        this.desiredType = desiredType;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
    }

    public @NotNull Class<?> getExpectedType() {
        return expectedType;
    }

    public @NotNull Class<?> getDesiredType() {
        return desiredType;
    }

    /**
     * @return the chain of types being resolved when the cycle was found, ending with the repeated type
     */
    public @NotNull List<Class<?>> getPath() {
        return path;
    }

    private static String message(Class<?> expectedType, Class<?> desiredType, List<Class<?>> path) {
        String lineSeparator = System.lineSeparator();
        StringBuilder builder = new StringBuilder();

        builder.append("A circular dependency was detected for the service of type '")
                .append(expectedType.getSimpleName())
                .append("' for '")
                .append(desiredType.getSimpleName())
                .append("'")
                .append(lineSeparator)
                .append("Cycle path:");

        for (Class<?> step : path) {
            builder.append(lineSeparator).append(" - ").append(ServiceKeys.describe(step));
        }

        return builder.toString();
    }
}
