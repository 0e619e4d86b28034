package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An {@link InstanceProducer} returns the same pre-built instance regardless of scope.
 */
public class InstanceProducer implements Producer {

    private final @NotNull Object instance;

    public InstanceProducer(@NotNull Object instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    @Override
    public @NotNull Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        return instance;
    }

    @Override
    public @NotNull Class<?> getType() {
        return instance.getClass();
    }
}
