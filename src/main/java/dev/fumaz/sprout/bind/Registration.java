package dev.fumaz.sprout.bind;

import dev.fumaz.sprout.resolver.Resolver;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link Registration} links a key to the {@link Resolver} that compiles its producer.
 */
public final class Registration {

    private final @NotNull Class<?> key;
    private final @NotNull Resolver resolver;

    public Registration(@NotNull Class<?> key, @NotNull Resolver resolver) {
        this.key = Objects.requireNonNull(key, "key");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public @NotNull Class<?> getKey() {
        return key;
    }

    public @NotNull Resolver getResolver() {
        return resolver;
    }

    public @NotNull ServiceLifetime getLifetime() {
        return resolver.getLifetime();
    }

    @Override
    public String toString() {
        return key.getName() + " -> " + resolver;
    }
}
