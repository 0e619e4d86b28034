package dev.fumaz.sprout.descriptor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;
import java.util.Optional;

/**
 * A named dependency of a constructor, field set or method, with its declared type when it has one.
 */
public final class Dependency {

    private final @NotNull String name;
    private final @Nullable Type type;

    private Dependency(@NotNull String name, @Nullable Type type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
    }

    public static @NotNull Dependency of(@NotNull String name, @Nullable Type type) {
        return new Dependency(name, type == Object.class ? null : type);
    }

    public static @NotNull Dependency untyped(@NotNull String name) {
        return new Dependency(name, null);
    }

    public @NotNull String getName() {
        return name;
    }

    public @Nullable Type getType() {
        return type;
    }

    public boolean isUntyped() {
        return type == null;
    }

    /**
     * @return whether the declared type offers a choice between several types, which cannot be resolved
     */
    public boolean isUnion() {
        if (type == Optional.class) {
            return true;
        }

        return type instanceof ParameterizedType && ((ParameterizedType) type).getRawType() == Optional.class;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Dependency)) {
            return false;
        }

        Dependency that = (Dependency) o;
        return name.equals(that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ": " + (type == null ? "<untyped>" : type.getTypeName());
    }
}
