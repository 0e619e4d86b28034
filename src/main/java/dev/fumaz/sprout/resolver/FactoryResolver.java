package dev.fumaz.sprout.resolver;

import dev.fumaz.sprout.bind.ServiceLifetime;
import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.producer.FactoryTypeProducer;
import dev.fumaz.sprout.producer.Producer;
import dev.fumaz.sprout.producer.ScopedFactoryTypeProducer;
import dev.fumaz.sprout.producer.SingletonFactoryTypeProducer;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Resolves a registration to a user-supplied {@link ServiceFactory}.
 * <p>
 * Factories never pull in other registrations while compiling, which is why they can break dependency cycles.
 */
public final class FactoryResolver implements Resolver {

    private final @NotNull Class<?> key;
    private final @NotNull Class<?> type;
    private final @NotNull ServiceFactory<?> factory;
    private final @NotNull ServiceLifetime lifetime;

    public FactoryResolver(@NotNull Class<?> key,
                           @NotNull Class<?> type,
                           @NotNull ServiceFactory<?> factory,
                           @NotNull ServiceLifetime lifetime) {
        this.key = Objects.requireNonNull(key, "key");
        this.type = Objects.requireNonNull(type, "type");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
    }

    @Override
    public @NotNull Producer resolve(@NotNull ResolutionContext context) {
        switch (lifetime) {
            case SINGLETON:
                return new SingletonFactoryTypeProducer(type, factory);
            case SCOPED:
                return new ScopedFactoryTypeProducer(key, type, factory);
            default:
                return new FactoryTypeProducer(type, factory);
        }
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    @Override
    public @NotNull ServiceLifetime getLifetime() {
        return lifetime;
    }

    @Override
    public String toString() {
        return "<Factory " + type.getSimpleName() + " " + lifetime + ">";
    }
}
