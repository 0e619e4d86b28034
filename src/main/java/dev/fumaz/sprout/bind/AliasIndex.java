package dev.fumaz.sprout.bind;

import dev.fumaz.sprout.exception.AliasAlreadyDefinedException;
import dev.fumaz.sprout.exception.AmbiguousAliasException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps free-text names to the registered types they may refer to.
 * <p>
 * Inferred aliases are populated from the names of every registered type and may be ambiguous;
 * exact aliases are defined by the user and always point to a single type.
 */
public final class AliasIndex {

    private final Map<String, Set<Class<?>>> inferred = new LinkedHashMap<>();
    private final Map<String, Class<?>> exact = new LinkedHashMap<>();

    public void infer(@NotNull Class<?> type) {
        for (String name : ServiceKeys.nameVariants(type)) {
            inferred.computeIfAbsent(name, ignored -> new LinkedHashSet<>()).add(type);
        }
    }

    public void addAlias(@NotNull String name, @NotNull Class<?> type) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");

        if (inferred.containsKey(name) || exact.containsKey(name)) {
            throw new AliasAlreadyDefinedException(name);
        }

        inferred.computeIfAbsent(name, ignored -> new LinkedHashSet<>()).add(type);
    }

    public void setAlias(@NotNull String name, @NotNull Class<?> type, boolean override) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");

        if (!override && exact.containsKey(name)) {
            throw new AliasAlreadyDefinedException(name);
        }

        exact.put(name, type);
    }

    /**
     * Looks up the type a parameter name refers to, preferring exact aliases.
     *
     * @param name         the parameter name
     * @param desiredType  the type that declares the parameter, reported when the name is ambiguous
     * @return the aliased type, or {@code null} if the name is unknown
     * @throws AmbiguousAliasException if the name only matches several inferred types
     */
    public @Nullable Class<?> lookup(@NotNull String name, @NotNull Class<?> desiredType) {
        Class<?> type = exact.get(name);

        if (type != null) {
            return type;
        }

        Set<Class<?>> candidates = inferred.get(name);

        if (candidates == null || candidates.isEmpty()) {
            return null;
        }

        if (candidates.size() > 1) {
            throw new AmbiguousAliasException(name, candidates, desiredType);
        }

        return candidates.iterator().next();
    }

    public @NotNull Map<String, Set<Class<?>>> getInferred() {
        return Collections.unmodifiableMap(inferred);
    }

    public @NotNull Map<String, Class<?>> getExact() {
        return Collections.unmodifiableMap(exact);
    }
}
