package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

/**
 * Constructs a type once per provider, with or without constructor arguments.
 */
public class SingletonTypeProducer extends SingletonProducer {

    private final @NotNull Invoker invoker;
    private final @NotNull Producer[] arguments;

    public SingletonTypeProducer(@NotNull Class<?> type, @NotNull Invoker invoker) {
        this(type, invoker, Producers.NO_ARGUMENTS);
    }

    public SingletonTypeProducer(@NotNull Class<?> type, @NotNull Invoker invoker, @NotNull Producer[] arguments) {
        super(type);
        this.invoker = invoker;
        this.arguments = arguments.clone();
    }

    @Override
    protected Object create(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return Producers.invoke(getType(), invoker, Producers.produceAll(arguments, scope, getType()));
    }
}
