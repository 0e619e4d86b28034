package dev.fumaz.sprout.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when an alias points to a type that was never registered in the container.
 */
public class AliasConfigurationException extends ConfigurationException {

    private final @NotNull String name;
    private final @NotNull Class<?> targetType;

    public AliasConfigurationException(@NotNull String name, @NotNull Class<?> targetType) {
        super("An alias '" + name + "' for type '" + targetType.getSimpleName()
                + "' was defined, but the type was not configured in the Container.");
        this.name = name;
        this.targetType = targetType;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Class<?> getTargetType() {
        return targetType;
    }
}
