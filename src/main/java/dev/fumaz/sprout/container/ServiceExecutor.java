package dev.fumaz.sprout.container;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Executes a method with arguments resolved from a {@link ServiceProvider}, inside a fresh
 * {@link dev.fumaz.sprout.scope.ActivationScope}.
 *
 * @param <R> the return type of the method
 */
@FunctionalInterface
public interface ServiceExecutor<R> {

    /**
     * @param scoped values seeding the scope of this execution, keyed by class or name; they take precedence over
     *               the provider's registrations
     */
    R execute(@Nullable Map<?, ?> scoped);

    default R execute() {
        return execute(null);
    }

}
