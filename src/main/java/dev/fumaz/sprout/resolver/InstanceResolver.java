package dev.fumaz.sprout.resolver;

import dev.fumaz.sprout.bind.ServiceLifetime;
import dev.fumaz.sprout.producer.InstanceProducer;
import dev.fumaz.sprout.producer.Producer;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Resolves to a pre-built instance, which is a singleton by nature.
 */
public final class InstanceResolver implements Resolver {

    private final @NotNull Object instance;

    public InstanceResolver(@NotNull Object instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    public @NotNull Object getInstance() {
        return instance;
    }

    @Override
    public @NotNull Producer resolve(@NotNull ResolutionContext context) {
        return new InstanceProducer(instance);
    }

    @Override
    public @NotNull ServiceLifetime getLifetime() {
        return ServiceLifetime.SINGLETON;
    }

    @Override
    public String toString() {
        return "<Singleton " + instance.getClass().getSimpleName() + ">";
    }
}
