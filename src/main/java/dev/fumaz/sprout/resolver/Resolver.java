package dev.fumaz.sprout.resolver;

import dev.fumaz.sprout.bind.ServiceLifetime;
import dev.fumaz.sprout.producer.Producer;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Resolver} compiles a registration into a {@link Producer}.
 */
public interface Resolver {

    @NotNull Producer resolve(@NotNull ResolutionContext context);

    @NotNull ServiceLifetime getLifetime();

}
