package dev.fumaz.sprout.descriptor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes how to instantiate a type and which dependencies it needs.
 * <p>
 * A {@link Style#CONSTRUCTOR} descriptor passes its dependencies positionally to the {@link Invoker}.
 * A {@link Style#FIELDS} descriptor creates the instance with no arguments and then assigns every dependency
 * through its {@link MemberWriter}.
 */
public final class TypeDescriptor {

    public enum Style {
        CONSTRUCTOR,
        FIELDS
    }

    private final @NotNull Class<?> type;
    private final @NotNull Style style;
    private final @NotNull List<Dependency> dependencies;
    private final @NotNull Invoker invoker;
    private final @Nullable MemberWriter writer;

    private TypeDescriptor(@NotNull Class<?> type,
                           @NotNull Style style,
                           @NotNull List<Dependency> dependencies,
                           @NotNull Invoker invoker,
                           @Nullable MemberWriter writer) {
        this.type = Objects.requireNonNull(type, "type");
        this.style = style;
        this.dependencies = List.copyOf(dependencies);
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.writer = writer;
    }

    public static @NotNull TypeDescriptor ofConstructor(@NotNull Class<?> type,
                                                        @NotNull List<Dependency> dependencies,
                                                        @NotNull Invoker invoker) {
        return new TypeDescriptor(type, Style.CONSTRUCTOR, dependencies, invoker, null);
    }

    public static @NotNull TypeDescriptor ofFields(@NotNull Class<?> type,
                                                   @NotNull List<Dependency> fields,
                                                   @NotNull Invoker invoker,
                                                   @NotNull MemberWriter writer) {
        return new TypeDescriptor(type, Style.FIELDS, fields, invoker, Objects.requireNonNull(writer, "writer"));
    }

    public static @NotNull TypeDescriptor ofNoDependencies(@NotNull Class<?> type, @NotNull Invoker invoker) {
        return ofConstructor(type, Collections.emptyList(), invoker);
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    public @NotNull Style getStyle() {
        return style;
    }

    public @NotNull List<Dependency> getDependencies() {
        return dependencies;
    }

    public @NotNull Invoker getInvoker() {
        return invoker;
    }

    public @NotNull MemberWriter getWriter() {
        if (writer == null) {
            throw new IllegalStateException("Descriptor of " + type.getName() + " does not assign members");
        }

        return writer;
    }
}
