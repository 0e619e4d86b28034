package dev.fumaz.sprout.resolver;

import dev.fumaz.sprout.bind.Registration;
import dev.fumaz.sprout.exception.CircularDependencyException;
import dev.fumaz.sprout.producer.Producer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State of a single compile pass: the producers compiled so far and the chain of types still being compiled.
 * <p>
 * Every key compiles to exactly one producer per pass, so dependents of a singleton share its instance.
 */
public final class ResolutionContext implements AutoCloseable {

    private final Map<Class<?>, Producer> resolved = new HashMap<>();
    private final List<Class<?>> chain = new ArrayList<>();

    public @Nullable Producer getResolved(@NotNull Class<?> key) {
        return resolved.get(key);
    }

    public boolean isResolved(@NotNull Class<?> key) {
        return resolved.containsKey(key);
    }

    /**
     * Returns the producer for a registration, compiling and memoizing it on first use.
     *
     * @throws CircularDependencyException if the registration is still being compiled further up the chain
     */
    public @NotNull Producer compile(@NotNull Registration registration) {
        Class<?> key = registration.getKey();
        Producer producer = resolved.get(key);

        if (producer != null) {
            return producer;
        }

        checkNotInChain(key);

        producer = registration.getResolver().resolve(this);
        resolved.put(key, producer);

        return producer;
    }

    public void checkNotInChain(@NotNull Class<?> key) {
        if (!chain.contains(key)) {
            return;
        }

        List<Class<?>> path = new ArrayList<>(chain.subList(chain.indexOf(key), chain.size()));
        path.add(key);

        throw new CircularDependencyException(chain.get(0), key, path);
    }

    void enter(@NotNull Class<?> key) {
        chain.add(key);
    }

    void exit(@NotNull Class<?> key) {
        int last = chain.size() - 1;

        if (last < 0 || chain.get(last) != key) {
            throw new IllegalStateException("Resolution chain mismatch while exiting " + key.getName());
        }

        chain.remove(last);
    }

    public void clearChain() {
        chain.clear();
    }

    public @NotNull List<Class<?>> getChain() {
        return Collections.unmodifiableList(chain);
    }

    @Override
    public void close() {
        resolved.clear();
        chain.clear();
    }
}
