package dev.fumaz.sprout.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a name maps to more than one registered type and no exact alias settles which one is meant.
 */
public class AmbiguousAliasException extends ConfigurationException {

    private final @NotNull String name;
    private final @NotNull List<Class<?>> candidates;
    private final @Nullable Class<?> desiredType;

    public AmbiguousAliasException(@NotNull String name, @NotNull Collection<Class<?>> candidates) {
        this(name, candidates, null);
    }

    public AmbiguousAliasException(@NotNull String name,
                                   @NotNull Collection<Class<?>> candidates,
                                   @Nullable Class<?> desiredType) {
        super(message(name, candidates, desiredType));
        this.name = name;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.desiredType = desiredType;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull List<Class<?>> getCandidates() {
        return candidates;
    }

    public @Nullable Class<?> getDesiredType() {
        return desiredType;
    }

    private static String message(String name, Collection<Class<?>> candidates, @Nullable Class<?> desiredType) {
        String listed = candidates.stream()
                .map(Class::getName)
                .collect(Collectors.joining(", "));

        String message = "The name '" + name + "' is ambiguous, it matches the types [" + listed + "]";

        if (desiredType != null) {
            message += " when resolving '" + desiredType.getSimpleName() + "'";
        }

        return message + ". Use an exact alias or declare the parameter type.";
    }
}
