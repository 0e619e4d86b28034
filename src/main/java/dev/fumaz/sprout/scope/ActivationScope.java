package dev.fumaz.sprout.scope;

import dev.fumaz.sprout.container.ServiceProvider;
import dev.fumaz.sprout.exception.ProvisionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * An {@link ActivationScope} is a unit of work: it caches the scoped services produced while it is active and
 * releases them when it is disposed.
 * <p>
 * Use it with try-with-resources. A scope is meant to be used by one thread at a time; the check-then-insert on its
 * cache is nevertheless atomic so that no scoped service is ever constructed twice.
 */
public class ActivationScope implements AutoCloseable {

    private final Object lock = new Object();
    private @Nullable ServiceProvider provider;
    private @Nullable Map<Object, Object> scopedServices;
    private final Deque<AutoCloseable> owned = new ArrayDeque<>();

    public ActivationScope(@NotNull ServiceProvider provider) {
        this(provider, null);
    }

    /**
     * @param provider       the provider that activates services in this scope
     * @param scopedServices values to seed the scope with, keyed by class or name; they take precedence over the
     *                       provider's registrations and are never closed by the scope
     */
    public ActivationScope(@NotNull ServiceProvider provider, @Nullable Map<?, ?> scopedServices) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.scopedServices = scopedServices == null ? new HashMap<>() : new HashMap<>(scopedServices);
    }

    public <T> T get(@NotNull Class<T> type) {
        return getProvider().get(type, this);
    }

    public Object get(@NotNull String name) {
        return getProvider().get(name, this);
    }

    public <T> @Nullable T getOrDefault(@NotNull Class<T> type, @Nullable T defaultValue) {
        return getProvider().getOrDefault(type, this, defaultValue);
    }

    public @NotNull ServiceProvider getProvider() {
        ServiceProvider current = provider;

        if (current == null) {
            throw new IllegalStateException("This ActivationScope is disposed and not bound to any provider");
        }

        return current;
    }

    public boolean contains(@NotNull Object key) {
        synchronized (lock) {
            return services().containsKey(key);
        }
    }

    public @Nullable Object getScoped(@NotNull Object key) {
        synchronized (lock) {
            return services().get(key);
        }
    }

    /**
     * Returns the instance cached under the key, creating and caching it first if the scope has none.
     */
    public @Nullable Object getOrCreate(@NotNull Object key, @NotNull Supplier<?> factory) {
        synchronized (lock) {
            Map<Object, Object> services = services();

            if (services.containsKey(key)) {
                return services.get(key);
            }

            Object created = factory.get();
            services.put(key, created);

            if (created instanceof AutoCloseable) {
                owned.push((AutoCloseable) created);
            }

            return created;
        }
    }

    public boolean isDisposed() {
        synchronized (lock) {
            return scopedServices == null;
        }
    }

    /**
     * Clears the scope and detaches it from its provider. Instances created by this scope that implement
     * {@link AutoCloseable} are closed, most recent first. Disposing twice has no effect.
     *
     * @throws ProvisionException if closing any of the instances failed; the scope is disposed regardless
     */
    public void dispose() {
        ProvisionException failure = null;

        synchronized (lock) {
            if (scopedServices == null) {
                return;
            }

            provider = null;
            scopedServices.clear();
            scopedServices = null;

            AutoCloseable closeable;
            while ((closeable = owned.poll()) != null) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    if (failure == null) {
                        failure = new ProvisionException("Failed to close scoped service " + closeable.getClass().getName(), e);
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() {
        dispose();
    }

    private Map<Object, Object> services() {
        if (scopedServices == null) {
            throw new IllegalStateException("This ActivationScope is disposed");
        }

        return scopedServices;
    }

}
