package dev.fumaz.sprout.exception;

import dev.fumaz.sprout.bind.ServiceKeys;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when registering a service would override one that is already registered under the same key.
 */
public class OverridingServiceException extends ConfigurationException {

    private final @NotNull Object key;

    public OverridingServiceException(@NotNull Object key, Object value) {
        super("A service with key '" + ServiceKeys.describe(key) + "' is already registered and would be overridden by "
                + value + ".");
        this.key = key;
    }

    public @NotNull Object getKey() {
        return key;
    }
}
