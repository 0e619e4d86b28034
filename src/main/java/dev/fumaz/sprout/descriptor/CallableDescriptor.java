package dev.fumaz.sprout.descriptor;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Describes the parameters of a method to be executed with injected arguments.
 */
public final class CallableDescriptor {

    private final @NotNull String name;
    private final @NotNull Class<?> declaringType;
    private final @NotNull Class<?> returnType;
    private final @NotNull List<Dependency> dependencies;
    private final @NotNull Invoker invoker;

    public CallableDescriptor(@NotNull String name,
                              @NotNull Class<?> declaringType,
                              @NotNull Class<?> returnType,
                              @NotNull List<Dependency> dependencies,
                              @NotNull Invoker invoker) {
        this.name = Objects.requireNonNull(name, "name");
        this.declaringType = Objects.requireNonNull(declaringType, "declaringType");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.dependencies = List.copyOf(dependencies);
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Class<?> getDeclaringType() {
        return declaringType;
    }

    public @NotNull Class<?> getReturnType() {
        return returnType;
    }

    public @NotNull List<Dependency> getDependencies() {
        return dependencies;
    }

    public @NotNull Invoker getInvoker() {
        return invoker;
    }
}
