package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Constructs a new instance of a type without dependencies on every call.
 */
public class TypeProducer implements Producer {

    private final @NotNull Class<?> type;
    private final @NotNull Invoker invoker;

    public TypeProducer(@NotNull Class<?> type, @NotNull Invoker invoker) {
        this.type = type;
        this.invoker = invoker;
    }

    @Override
    public Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return Producers.invoke(type, invoker, Producers.NO_VALUES);
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }
}
