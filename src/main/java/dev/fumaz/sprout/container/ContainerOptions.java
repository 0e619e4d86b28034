package dev.fumaz.sprout.container;

import dev.fumaz.sprout.descriptor.DescriptorProvider;
import dev.fumaz.sprout.descriptor.ReflectiveDescriptorProvider;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Configuration object controlling how a {@link Container} resolves dependencies.
 */
public final class ContainerOptions {

    private final boolean strict;
    private final AmbiguousAliasPolicy ambiguousAliasPolicy;
    private final DescriptorProvider descriptorProvider;

    private ContainerOptions(boolean strict,
                             AmbiguousAliasPolicy ambiguousAliasPolicy,
                             DescriptorProvider descriptorProvider) {
        this.strict = strict;
        this.ambiguousAliasPolicy = ambiguousAliasPolicy;
        this.descriptorProvider = descriptorProvider;
    }

    /**
     * @return whether name-based resolution is disabled, requiring every dependency to declare its type
     */
    public boolean isStrict() {
        return strict;
    }

    public @NotNull AmbiguousAliasPolicy getAmbiguousAliasPolicy() {
        return ambiguousAliasPolicy;
    }

    public @NotNull DescriptorProvider getDescriptorProvider() {
        return descriptorProvider;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ContainerOptions defaults() {
        return builder().build();
    }

    public static final class Builder {
        private boolean strict = false;
        private AmbiguousAliasPolicy ambiguousAliasPolicy = AmbiguousAliasPolicy.LENIENT;
        private DescriptorProvider descriptorProvider;

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder ambiguousAliasPolicy(@NotNull AmbiguousAliasPolicy policy) {
            this.ambiguousAliasPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder descriptorProvider(@NotNull DescriptorProvider descriptorProvider) {
            this.descriptorProvider = Objects.requireNonNull(descriptorProvider, "descriptorProvider");
            return this;
        }

        public ContainerOptions build() {
            DescriptorProvider descriptors = descriptorProvider == null
                    ? new ReflectiveDescriptorProvider()
                    : descriptorProvider;

            return new ContainerOptions(strict, ambiguousAliasPolicy, descriptors);
        }
    }
}
