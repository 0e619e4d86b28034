package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.exception.SproutException;
import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Helpers shared by the {@link Producer} implementations.
 */
public final class Producers {

    static final Producer[] NO_ARGUMENTS = new Producer[0];
    static final Object[] NO_VALUES = new Object[0];

    private Producers() {
    }

    public static @NotNull Object[] produceAll(@NotNull Producer[] producers,
                                              @NotNull ActivationScope scope,
                                              @NotNull Class<?> requestingType) {
        if (producers.length == 0) {
            return NO_VALUES;
        }

        Object[] values = new Object[producers.length];

        for (int i = 0; i < producers.length; i++) {
            values[i] = producers[i].produce(scope, requestingType);
        }

        return values;
    }

    public static @Nullable Object invoke(@NotNull Class<?> type, @NotNull Invoker invoker, @NotNull Object[] arguments) {
        try {
            return invoker.invoke(arguments);
        } catch (SproutException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new ProvisionException("Failed to construct " + type.getName(), e);
        }
    }

    public static @Nullable Object call(@NotNull Class<?> type,
                                        @NotNull ServiceFactory<?> factory,
                                        @NotNull ActivationScope scope,
                                        @NotNull Class<?> requestingType) {
        try {
            return factory.create(scope, requestingType);
        } catch (SproutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProvisionException("Factory for " + type.getName() + " failed", e);
        }
    }
}
