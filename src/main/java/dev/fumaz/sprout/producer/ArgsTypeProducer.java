package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Constructs a new instance on every call, producing each constructor argument first.
 */
public class ArgsTypeProducer implements Producer {

    private final @NotNull Class<?> type;
    private final @NotNull Invoker invoker;
    private final @NotNull Producer[] arguments;

    public ArgsTypeProducer(@NotNull Class<?> type, @NotNull Invoker invoker, @NotNull Producer[] arguments) {
        this.type = type;
        this.invoker = invoker;
        this.arguments = arguments.clone();
    }

    @Override
    public Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return Producers.invoke(type, invoker, Producers.produceAll(arguments, scope, type));
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }
}
