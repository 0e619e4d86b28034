package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Calls a factory on every request.
 */
public class FactoryTypeProducer implements Producer {

    private final @NotNull Class<?> type;
    private final @NotNull ServiceFactory<?> factory;

    public FactoryTypeProducer(@NotNull Class<?> type, @NotNull ServiceFactory<?> factory) {
        this.type = type;
        this.factory = factory;
    }

    @Override
    public Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return Producers.call(type, factory, scope, requestingType);
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }
}
