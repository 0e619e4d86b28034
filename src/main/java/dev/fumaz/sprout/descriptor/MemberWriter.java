package dev.fumaz.sprout.descriptor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Assigns a dependency to a member of an already constructed instance. Members are addressed by the position of
 * their dependency in the owning {@link TypeDescriptor}.
 */
@FunctionalInterface
public interface MemberWriter {

    void write(@NotNull Object instance, int index, @Nullable Object value) throws Throwable;

}
