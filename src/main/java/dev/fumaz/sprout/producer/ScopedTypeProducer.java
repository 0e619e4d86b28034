package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Constructs a type without dependencies once per {@link ActivationScope}.
 */
public class ScopedTypeProducer implements Producer {

    private final @NotNull Class<?> key;
    private final @NotNull Class<?> type;
    private final @NotNull Invoker invoker;

    public ScopedTypeProducer(@NotNull Class<?> key, @NotNull Class<?> type, @NotNull Invoker invoker) {
        this.key = key;
        this.type = type;
        this.invoker = invoker;
    }

    @Override
    public Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return scope.getOrCreate(key, () -> Producers.invoke(type, invoker, Producers.NO_VALUES));
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }
}
