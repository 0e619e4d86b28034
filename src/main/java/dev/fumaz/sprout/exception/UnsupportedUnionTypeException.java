package dev.fumaz.sprout.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a dependency is declared as an {@link java.util.Optional} or any other choice between several types.
 */
public class UnsupportedUnionTypeException extends CannotResolveParameterException {

    public UnsupportedUnionTypeException(@NotNull String parameterName, @NotNull Class<?> desiredType) {
        super(parameterName, desiredType, "Union or Optional type declaration is not supported. Cannot resolve parameter '"
                + parameterName + "' when resolving '" + desiredType.getSimpleName() + "'");
    }
}
