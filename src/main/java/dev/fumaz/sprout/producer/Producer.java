package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Producer} is the compiled form of a registration: it yields an instance of a service without any further
 * lookups or reflection.
 */
public interface Producer {

    /**
     * @param scope          the scope of the current activation
     * @param requestingType the type being activated that asked for this service, or the requested type itself
     * @return the instance
     */
    @Nullable Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType);

    /**
     * @return the type of the instances this producer yields
     */
    @NotNull Class<?> getType();

}
