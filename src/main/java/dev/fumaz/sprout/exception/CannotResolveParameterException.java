package dev.fumaz.sprout.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a dependency needed to instantiate a type cannot be mapped to any registered service.
 */
public class CannotResolveParameterException extends ConfigurationException {

    private final @NotNull String parameterName;
    private final @NotNull Class<?> desiredType;

    public CannotResolveParameterException(@NotNull String parameterName, @NotNull Class<?> desiredType) {
        this(parameterName, desiredType, "Unable to resolve parameter '" + parameterName + "' when resolving '"
                + desiredType.getSimpleName() + "'");
    }

    protected CannotResolveParameterException(@NotNull String parameterName,
                                              @NotNull Class<?> desiredType,
                                              @NotNull String message) {
        super(message);
        this.parameterName = parameterName;
        this.desiredType = desiredType;
    }

    public @NotNull String getParameterName() {
        return parameterName;
    }

    public @NotNull Class<?> getDesiredType() {
        return desiredType;
    }
}
