package dev.fumaz.sprout.exception;

import dev.fumaz.sprout.bind.ServiceKeys;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a service is requested by a key that the provider does not know.
 */
public class CannotResolveTypeException extends SproutException {

    private final @NotNull Object key;

    public CannotResolveTypeException(@NotNull Object key) {
        super("Unable to resolve the type '" + ServiceKeys.describe(key) + "'.");
        this.key = key;
    }

    public @NotNull Object getKey() {
        return key;
    }
}
