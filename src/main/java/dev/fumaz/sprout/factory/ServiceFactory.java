package dev.fumaz.sprout.factory;

import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A user-supplied factory of service instances.
 * <p>
 * Every factory is called with the active scope and the type being activated that asked for the service, which
 * lets a factory produce different instances depending on who is asking. Factories that need neither are adapted
 * once, at registration, through {@link #noArgs(Supplier)} and {@link #withScope(Function)}.
 *
 * @param <T> the type of the produced instances
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    static <T> @NotNull ServiceFactory<T> noArgs(@NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return (scope, activatingType) -> supplier.get();
    }

    static <T> @NotNull ServiceFactory<T> withScope(@NotNull Function<? super ActivationScope, ? extends T> function) {
        Objects.requireNonNull(function, "function");

        return (scope, activatingType) -> function.apply(scope);
    }

    T create(@NotNull ActivationScope scope, @NotNull Class<?> activatingType);

}
