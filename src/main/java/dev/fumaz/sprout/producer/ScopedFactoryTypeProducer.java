package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Calls a factory once per {@link ActivationScope}.
 */
public class ScopedFactoryTypeProducer implements Producer {

    private final @NotNull Class<?> key;
    private final @NotNull Class<?> type;
    private final @NotNull ServiceFactory<?> factory;

    public ScopedFactoryTypeProducer(@NotNull Class<?> key, @NotNull Class<?> type, @NotNull ServiceFactory<?> factory) {
        this.key = key;
        this.type = type;
        this.factory = factory;
    }

    @Override
    public Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return scope.getOrCreate(key, () -> Producers.call(type, factory, scope, requestingType));
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }
}
