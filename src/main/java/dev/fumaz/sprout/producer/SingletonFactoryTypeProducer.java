package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Calls a factory once per provider.
 */
public class SingletonFactoryTypeProducer extends SingletonProducer {

    private final @NotNull ServiceFactory<?> factory;

    public SingletonFactoryTypeProducer(@NotNull Class<?> type, @NotNull ServiceFactory<?> factory) {
        super(type);
        this.factory = factory;
    }

    @Override
    protected Object create(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return Producers.call(getType(), factory, scope, requestingType);
    }
}
