package dev.fumaz.sprout.descriptor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;

/**
 * Supplies the dependency descriptions the resolution engine works from.
 * <p>
 * The engine never inspects types itself; everything it knows about constructors, fields and method parameters
 * comes from the descriptors returned here.
 */
public interface DescriptorProvider {

    @NotNull TypeDescriptor describe(@NotNull Class<?> type);

    /**
     * Describes a method so it can be executed with injected arguments.
     *
     * @param method the method
     * @param target the receiver, {@code null} for static methods
     */
    @NotNull CallableDescriptor describe(@NotNull Method method, @Nullable Object target);

}
