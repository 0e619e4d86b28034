package dev.fumaz.sprout.descriptor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link DescriptorProvider} holding explicitly declared descriptors, falling back to another provider for the
 * types it does not list.
 */
public class DescriptorTable implements DescriptorProvider {

    private final Map<Class<?>, TypeDescriptor> descriptors = new ConcurrentHashMap<>();
    private final @NotNull DescriptorProvider fallback;

    public DescriptorTable() {
        this(new ReflectiveDescriptorProvider());
    }

    public DescriptorTable(@NotNull DescriptorProvider fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public @NotNull DescriptorTable put(@NotNull TypeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");

        if (descriptors.putIfAbsent(descriptor.getType(), descriptor) != null) {
            throw new IllegalArgumentException("A descriptor for " + descriptor.getType().getName()
                    + " is already declared");
        }

        return this;
    }

    public boolean contains(@NotNull Class<?> type) {
        return descriptors.containsKey(type);
    }

    @Override
    public @NotNull TypeDescriptor describe(@NotNull Class<?> type) {
        TypeDescriptor descriptor = descriptors.get(type);

        if (descriptor != null) {
            return descriptor;
        }

        return fallback.describe(type);
    }

    @Override
    public @NotNull CallableDescriptor describe(@NotNull Method method, @Nullable Object target) {
        return fallback.describe(method, target);
    }
}
