package dev.fumaz.sprout.container;

import dev.fumaz.sprout.bind.ServiceKeys;
import dev.fumaz.sprout.descriptor.CallableDescriptor;
import dev.fumaz.sprout.descriptor.DescriptorProvider;
import dev.fumaz.sprout.descriptor.Dependency;
import dev.fumaz.sprout.descriptor.ReflectiveDescriptorProvider;
import dev.fumaz.sprout.exception.CannotResolveParameterException;
import dev.fumaz.sprout.exception.CannotResolveTypeException;
import dev.fumaz.sprout.exception.OverridingServiceException;
import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.exception.SproutException;
import dev.fumaz.sprout.exception.UnsupportedUnionTypeException;
import dev.fumaz.sprout.producer.InstanceProducer;
import dev.fumaz.sprout.producer.Producer;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link ServiceProvider} activates services from the producers compiled by {@link Container#build()}.
 * <p>
 * The provider is safe to share between threads. Its services are keyed by class and by name; the only way to add
 * entries after it was built is {@link #set(Object, Object)}.
 */
public class ServiceProvider {

    private final @NotNull ConcurrentMap<Object, Producer> producers;
    private final @NotNull ConcurrentMap<Method, MethodExecutor<?>> executors = new ConcurrentHashMap<>();
    private final @NotNull DescriptorProvider descriptors;

    public ServiceProvider() {
        this(Collections.emptyMap(), new ReflectiveDescriptorProvider());
    }

    public ServiceProvider(@NotNull Map<?, Producer> producers, @NotNull DescriptorProvider descriptors) {
        this.producers = new ConcurrentHashMap<>(producers);
        this.descriptors = Objects.requireNonNull(descriptors, "descriptors");
    }

    public boolean contains(@NotNull Object key) {
        return producers.containsKey(key);
    }

    public <T> T get(@NotNull Class<T> type) {
        return get(type, null);
    }

    public <T> T get(@NotNull Class<T> type, @Nullable ActivationScope scope) {
        return type.cast(activate(type, scope, false, null));
    }

    public <T> @Nullable T getOrDefault(@NotNull Class<T> type, @Nullable ActivationScope scope, @Nullable T defaultValue) {
        return type.cast(activate(type, scope, true, defaultValue));
    }

    public Object get(@NotNull String name) {
        return get(name, null);
    }

    public Object get(@NotNull String name, @Nullable ActivationScope scope) {
        return activate(name, scope, false, null);
    }

    public @Nullable Object getOrDefault(@NotNull String name, @Nullable ActivationScope scope, @Nullable Object defaultValue) {
        return activate(name, scope, true, defaultValue);
    }

    /**
     * Registers a value as a singleton service. A class key is also registered under its simple name.
     *
     * @param key   a {@link Class} or a {@link String} name
     * @param value the service
     * @throws OverridingServiceException if the key, or the simple name of a class key, is already present
     */
    public void set(@NotNull Object key, @NotNull Object value) {
        Objects.requireNonNull(value, "value");
        InstanceProducer producer = new InstanceProducer(value);

        if (key instanceof Class) {
            String name = ServiceKeys.canonicalName((Class<?>) key);

            if (name != null && producers.containsKey(name)) {
                throw new OverridingServiceException(name, value);
            }

            if (producers.putIfAbsent(key, producer) != null) {
                throw new OverridingServiceException(key, value);
            }

            if (name != null) {
                producers.putIfAbsent(name, producer);
            }

            return;
        }

        if (!(key instanceof String)) {
            throw new IllegalArgumentException("Service keys must be classes or names, got " + key);
        }

        if (producers.putIfAbsent(key, producer) != null) {
            throw new OverridingServiceException(key, value);
        }
    }

    public @NotNull ActivationScope createScope() {
        return new ActivationScope(this);
    }

    public @NotNull ActivationScope createScope(@Nullable Map<?, ?> scoped) {
        return new ActivationScope(this, scoped);
    }

    /**
     * Returns an executor that calls the method with arguments resolved by declared type, or by name for parameters
     * declared as {@link Object}.
     * <p>
     * Executors of static methods are memoized per method. Executors of instance methods are bound to their receiver
     * and created on every call, so the provider never retains receivers; callers that execute the same receiver
     * repeatedly should keep the returned executor.
     *
     * @param method the method
     * @param target the receiver, {@code null} for static methods
     */
    public <R> @NotNull ServiceExecutor<R> getExecutor(@NotNull Method method, @Nullable Object target) {
        return getMethodExecutor(method, target);
    }

    public <R> R exec(@NotNull Method method, @Nullable Object target) {
        return exec(method, target, null);
    }

    public <R> R exec(@NotNull Method method, @Nullable Object target, @Nullable Map<?, ?> scoped) {
        return this.<R>getMethodExecutor(method, target).execute(scoped);
    }

    /**
     * Executes a method returning a {@link CompletionStage}. Arguments are resolved synchronously before the method
     * is called; the scope of the execution is disposed once the stage completes.
     */
    public <R> @NotNull CompletableFuture<R> execAsync(@NotNull Method method,
                                                       @Nullable Object target,
                                                       @Nullable Map<?, ?> scoped) {
        return this.<R>getMethodExecutor(method, target).executeAsync(scoped);
    }

    private @Nullable Object activate(@NotNull Object key,
                                      @Nullable ActivationScope scope,
                                      boolean hasDefault,
                                      @Nullable Object defaultValue) {
        Objects.requireNonNull(key, "key");

        if (scope != null && scope.contains(key)) {
            return scope.getScoped(key);
        }

        Producer producer = producers.get(key);

        if (producer == null) {
            if (hasDefault) {
                return defaultValue;
            }

            throw new CannotResolveTypeException(key);
        }

        ActivationScope active = scope == null ? new ActivationScope(this) : scope;
        Class<?> requestingType = key instanceof Class ? (Class<?>) key : producer.getType();

        return producer.produce(active, requestingType);
    }

    @SuppressWarnings("unchecked")
    private <R> MethodExecutor<R> getMethodExecutor(Method method, @Nullable Object target) {
        Objects.requireNonNull(method, "method");

        if (!Modifier.isStatic(method.getModifiers())) {
            return new MethodExecutor<>(descriptors.describe(method, target));
        }

        return (MethodExecutor<R>) executors.computeIfAbsent(method,
                ignored -> new MethodExecutor<>(descriptors.describe(method, null)));
    }

    private final class MethodExecutor<R> implements ServiceExecutor<R> {

        private final @NotNull CallableDescriptor descriptor;
        private final @NotNull Object[] keys;

        private MethodExecutor(@NotNull CallableDescriptor descriptor) {
            this.descriptor = descriptor;

            List<Dependency> dependencies = descriptor.getDependencies();
            this.keys = new Object[dependencies.size()];

            for (int i = 0; i < keys.length; i++) {
                Dependency dependency = dependencies.get(i);
                Type type = dependency.getType();

                if (type == null) {
                    keys[i] = dependency.getName();
                } else if (dependency.isUnion()) {
                    throw new UnsupportedUnionTypeException(dependency.getName(), descriptor.getDeclaringType());
                } else if (type instanceof Class) {
                    keys[i] = type;
                } else {
                    throw new CannotResolveParameterException(dependency.getName(), descriptor.getDeclaringType());
                }
            }
        }

        @Override
        public R execute(@Nullable Map<?, ?> scoped) {
            try (ActivationScope scope = new ActivationScope(ServiceProvider.this, scoped)) {
                return cast(invoke(scope));
            }
        }

        private CompletableFuture<R> executeAsync(@Nullable Map<?, ?> scoped) {
            if (!CompletionStage.class.isAssignableFrom(descriptor.getReturnType())) {
                throw new IllegalArgumentException("Method " + descriptor.getName() + " of "
                        + descriptor.getDeclaringType().getName() + " does not return a CompletionStage");
            }

            ActivationScope scope = new ActivationScope(ServiceProvider.this, scoped);
            CompletionStage<R> stage;

            try {
                stage = cast(invoke(scope));
            } catch (RuntimeException | Error e) {
                scope.dispose();
                throw e;
            }

            if (stage == null) {
                scope.dispose();
                throw new ProvisionException("Method " + descriptor.getName() + " returned no CompletionStage");
            }

            return stage.whenComplete((result, error) -> scope.dispose()).toCompletableFuture();
        }

        private Object invoke(ActivationScope scope) {
            Object[] arguments = new Object[keys.length];

            for (int i = 0; i < keys.length; i++) {
                arguments[i] = activate(keys[i], scope, false, null);
            }

            try {
                return descriptor.getInvoker().invoke(arguments);
            } catch (SproutException | Error e) {
                throw e;
            } catch (Throwable e) {
                throw new ProvisionException("Failed to execute " + descriptor.getName() + " of "
                        + descriptor.getDeclaringType().getName(), e);
            }
        }

        @SuppressWarnings("unchecked")
        private <V> V cast(Object value) {
            return (V) value;
        }
    }
}
