package dev.fumaz.sprout.bind;

import dev.fumaz.sprout.descriptor.DescriptorProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only view of the registrations that resolvers consult while compiling producers.
 */
public interface Registry {

    @Nullable Registration getRegistration(@NotNull Class<?> key);

    @NotNull AliasIndex getAliases();

    @NotNull DescriptorProvider getDescriptorProvider();

    boolean isStrict();

}
