package dev.fumaz.sprout.container;

import dev.fumaz.sprout.bind.AliasIndex;
import dev.fumaz.sprout.bind.Registration;
import dev.fumaz.sprout.bind.Registry;
import dev.fumaz.sprout.bind.ServiceKeys;
import dev.fumaz.sprout.bind.ServiceLifetime;
import dev.fumaz.sprout.descriptor.DescriptorProvider;
import dev.fumaz.sprout.exception.AliasConfigurationException;
import dev.fumaz.sprout.exception.AmbiguousAliasException;
import dev.fumaz.sprout.exception.InvalidOperationInStrictModeException;
import dev.fumaz.sprout.exception.MissingTypeException;
import dev.fumaz.sprout.exception.OverridingServiceException;
import dev.fumaz.sprout.factory.Factories;
import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.producer.Producer;
import dev.fumaz.sprout.resolver.DynamicResolver;
import dev.fumaz.sprout.resolver.FactoryResolver;
import dev.fumaz.sprout.resolver.InstanceResolver;
import dev.fumaz.sprout.resolver.ResolutionContext;
import dev.fumaz.sprout.resolver.Resolver;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * A {@link Container} collects service registrations and compiles them into a {@link ServiceProvider}.
 * <p>
 * Containers are configured from a single thread. Every mutation invalidates the provider returned by
 * {@link #getProvider()}, which is rebuilt on its next use.
 */
public class Container implements Registry, Iterable<Registration> {

    private static final Logger LOGGER = Logger.getLogger(Container.class.getName());

    private final @NotNull ContainerOptions options;
    private final @NotNull Map<Class<?>, Registration> registrations = new LinkedHashMap<>();
    private final @NotNull AliasIndex aliases = new AliasIndex();
    private @Nullable ServiceProvider provider;

    public Container() {
        this(ContainerOptions.defaults());
    }

    public Container(@NotNull ContainerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @return a container that only resolves dependencies by their declared type
     */
    public static @NotNull Container strict() {
        return new Container(ContainerOptions.builder().strict(true).build());
    }

    public @NotNull ContainerOptions getOptions() {
        return options;
    }

    @Override
    public @Nullable Registration getRegistration(@NotNull Class<?> key) {
        return registrations.get(key);
    }

    @Override
    public @NotNull AliasIndex getAliases() {
        return aliases;
    }

    @Override
    public @NotNull DescriptorProvider getDescriptorProvider() {
        return options.getDescriptorProvider();
    }

    @Override
    public boolean isStrict() {
        return options.isStrict();
    }

    public boolean contains(@NotNull Object key) {
        return key instanceof Class && registrations.containsKey(key);
    }

    public int size() {
        return registrations.size();
    }

    @Override
    public @NotNull Iterator<Registration> iterator() {
        return Collections.unmodifiableCollection(registrations.values()).iterator();
    }

    public <T> @NotNull Container bindTypes(@NotNull Class<T> baseType,
                                            @NotNull Class<? extends T> concreteType,
                                            @NotNull ServiceLifetime lifetime) {
        Objects.requireNonNull(baseType, "baseType");
        Objects.requireNonNull(concreteType, "concreteType");

        if (!baseType.isAssignableFrom(concreteType)) {
            throw new IllegalArgumentException("Type " + concreteType.getName() + " is not assignable to " + baseType.getName());
        }

        if (concreteType.isInterface() || Modifier.isAbstract(concreteType.getModifiers())) {
            throw new IllegalArgumentException("Type " + concreteType.getName() + " is abstract and cannot be activated");
        }

        bind(baseType, new DynamicResolver(baseType, concreteType, lifetime, this));
        return this;
    }

    public @NotNull Container register(@NotNull Class<?> type) {
        return addTransient(type);
    }

    public <T> @NotNull Container register(@NotNull Class<T> baseType, @NotNull Class<? extends T> concreteType) {
        return addTransient(baseType, concreteType);
    }

    public @NotNull Container addTransient(@NotNull Class<?> type) {
        return addSelf(type, ServiceLifetime.TRANSIENT);
    }

    public <T> @NotNull Container addTransient(@NotNull Class<T> baseType, @NotNull Class<? extends T> concreteType) {
        return bindTypes(baseType, concreteType, ServiceLifetime.TRANSIENT);
    }

    public @NotNull Container addScoped(@NotNull Class<?> type) {
        return addSelf(type, ServiceLifetime.SCOPED);
    }

    public <T> @NotNull Container addScoped(@NotNull Class<T> baseType, @NotNull Class<? extends T> concreteType) {
        return bindTypes(baseType, concreteType, ServiceLifetime.SCOPED);
    }

    public @NotNull Container addSingleton(@NotNull Class<?> type) {
        return addSelf(type, ServiceLifetime.SINGLETON);
    }

    public <T> @NotNull Container addSingleton(@NotNull Class<T> baseType, @NotNull Class<? extends T> concreteType) {
        return bindTypes(baseType, concreteType, ServiceLifetime.SINGLETON);
    }

    /**
     * Registers an existing object as a singleton under its runtime class.
     */
    public @NotNull Container addInstance(@NotNull Object instance) {
        Objects.requireNonNull(instance, "instance");

        bind(instance.getClass(), new InstanceResolver(instance));
        return this;
    }

    public <T> @NotNull Container addInstance(@NotNull T instance, @Nullable Class<? super T> declaredType) {
        Objects.requireNonNull(instance, "instance");

        if (declaredType == null) {
            return addInstance(instance);
        }

        if (!declaredType.isInstance(instance)) {
            throw new IllegalArgumentException("Instance of " + instance.getClass().getName() + " is not a " + declaredType.getName());
        }

        bind(declaredType, new InstanceResolver(instance));
        return this;
    }

    public <T> @NotNull Container addTransientByFactory(@Nullable Class<T> returnType, @NotNull Supplier<? extends T> factory) {
        return registerFactory(ServiceFactory.noArgs(factory), returnType, ServiceLifetime.TRANSIENT);
    }

    public <T> @NotNull Container addTransientByFactory(@Nullable Class<T> returnType,
                                                        @NotNull Function<? super ActivationScope, ? extends T> factory) {
        return registerFactory(ServiceFactory.withScope(factory), returnType, ServiceLifetime.TRANSIENT);
    }

    public <T> @NotNull Container addTransientByFactory(@Nullable Class<T> returnType, @NotNull ServiceFactory<? extends T> factory) {
        return registerFactory(factory, returnType, ServiceLifetime.TRANSIENT);
    }

    public @NotNull Container addTransientByFactory(@NotNull Method method, @Nullable Object target) {
        return registerFactory(method, target, null, ServiceLifetime.TRANSIENT);
    }

    public <T> @NotNull Container addScopedByFactory(@Nullable Class<T> returnType, @NotNull Supplier<? extends T> factory) {
        return registerFactory(ServiceFactory.noArgs(factory), returnType, ServiceLifetime.SCOPED);
    }

    public <T> @NotNull Container addScopedByFactory(@Nullable Class<T> returnType,
                                                     @NotNull Function<? super ActivationScope, ? extends T> factory) {
        return registerFactory(ServiceFactory.withScope(factory), returnType, ServiceLifetime.SCOPED);
    }

    public <T> @NotNull Container addScopedByFactory(@Nullable Class<T> returnType, @NotNull ServiceFactory<? extends T> factory) {
        return registerFactory(factory, returnType, ServiceLifetime.SCOPED);
    }

    public @NotNull Container addScopedByFactory(@NotNull Method method, @Nullable Object target) {
        return registerFactory(method, target, null, ServiceLifetime.SCOPED);
    }

    public <T> @NotNull Container addSingletonByFactory(@Nullable Class<T> returnType, @NotNull Supplier<? extends T> factory) {
        return registerFactory(ServiceFactory.noArgs(factory), returnType, ServiceLifetime.SINGLETON);
    }

    public <T> @NotNull Container addSingletonByFactory(@Nullable Class<T> returnType,
                                                        @NotNull Function<? super ActivationScope, ? extends T> factory) {
        return registerFactory(ServiceFactory.withScope(factory), returnType, ServiceLifetime.SINGLETON);
    }

    public <T> @NotNull Container addSingletonByFactory(@Nullable Class<T> returnType, @NotNull ServiceFactory<? extends T> factory) {
        return registerFactory(factory, returnType, ServiceLifetime.SINGLETON);
    }

    public @NotNull Container addSingletonByFactory(@NotNull Method method, @Nullable Object target) {
        return registerFactory(method, target, null, ServiceLifetime.SINGLETON);
    }

    /**
     * Registers a factory for the given type.
     *
     * @throws MissingTypeException if no type is given
     */
    public <T> @NotNull Container registerFactory(@NotNull ServiceFactory<? extends T> factory,
                                                  @Nullable Class<T> returnType,
                                                  @NotNull ServiceLifetime lifetime) {
        if (returnType == null) {
            throw new MissingTypeException();
        }

        Objects.requireNonNull(factory, "factory");

        bind(returnType, new FactoryResolver(returnType, returnType, factory, lifetime));
        return this;
    }

    /**
     * Registers a method as a factory. The type is taken from the method's return type unless one is given.
     */
    public @NotNull Container registerFactory(@NotNull Method method,
                                              @Nullable Object target,
                                              @Nullable Class<?> returnType,
                                              @NotNull ServiceLifetime lifetime) {
        Class<?> type = Factories.returnType(method, returnType);

        bind(type, new FactoryResolver(type, type, Factories.fromMethod(method, target, type), lifetime));
        return this;
    }

    public @NotNull Container addAlias(@NotNull String name, @NotNull Class<?> type) {
        checkNotStrict();

        aliases.addAlias(name, type);
        provider = null;
        return this;
    }

    public @NotNull Container addAliases(@NotNull Map<String, ? extends Class<?>> values) {
        checkNotStrict();

        for (Map.Entry<String, ? extends Class<?>> entry : values.entrySet()) {
            addAlias(entry.getKey(), entry.getValue());
        }

        return this;
    }

    public @NotNull Container setAlias(@NotNull String name, @NotNull Class<?> type) {
        return setAlias(name, type, false);
    }

    public @NotNull Container setAlias(@NotNull String name, @NotNull Class<?> type, boolean override) {
        checkNotStrict();

        aliases.setAlias(name, type, override);
        provider = null;
        return this;
    }

    public @NotNull Container setAliases(@NotNull Map<String, ? extends Class<?>> values) {
        return setAliases(values, false);
    }

    public @NotNull Container setAliases(@NotNull Map<String, ? extends Class<?>> values, boolean override) {
        checkNotStrict();

        for (Map.Entry<String, ? extends Class<?>> entry : values.entrySet()) {
            setAlias(entry.getKey(), entry.getValue(), override);
        }

        return this;
    }

    public <T> T resolve(@NotNull Class<T> type) {
        return getProvider().get(type);
    }

    public <T> T resolve(@NotNull Class<T> type, @Nullable ActivationScope scope) {
        return getProvider().get(type, scope);
    }

    public Object resolve(@NotNull String name) {
        return getProvider().get(name);
    }

    /**
     * @return the provider built from the current registrations, built again after any change
     */
    public @NotNull ServiceProvider getProvider() {
        if (provider == null) {
            provider = build();
        }

        return provider;
    }

    /**
     * Compiles every registration into a new {@link ServiceProvider}.
     * <p>
     * Every configuration error is reported here: unresolvable or circular dependencies, ambiguous names and aliases
     * pointing at unregistered types.
     */
    public @NotNull ServiceProvider build() {
        Map<Object, Producer> producers = new LinkedHashMap<>();
        Set<String> collidingNames = new HashSet<>();

        try (ResolutionContext context = new ResolutionContext()) {
            for (Registration registration : registrations.values()) {
                Class<?> key = registration.getKey();
                Producer producer = context.getResolved(key);

                if (producer == null) {
                    if (registration.getResolver() instanceof DynamicResolver) {
                        context.clearChain();
                    }

                    producer = context.compile(registration);
                }

                producers.put(key, producer);

                String name = ServiceKeys.canonicalName(key);

                if (name != null) {
                    putName(producers, collidingNames, name, producer);
                }
            }
        }

        if (!isStrict()) {
            includeInferredAliases(producers);
            includeExactAliases(producers);
        }

        LOGGER.fine(() -> "Built service provider with " + registrations.size() + " services and "
                + (producers.size() - registrations.size()) + " names");

        return new ServiceProvider(producers, options.getDescriptorProvider());
    }

    private static void putName(Map<Object, Producer> producers, Set<String> collidingNames, String name, Producer producer) {
        if (collidingNames.contains(name)) {
            return;
        }

        Producer existing = producers.putIfAbsent(name, producer);

        if (existing != null && existing != producer) {
            producers.remove(name);
            collidingNames.add(name);
        }
    }

    private void includeInferredAliases(Map<Object, Producer> producers) {
        for (Map.Entry<String, Set<Class<?>>> entry : aliases.getInferred().entrySet()) {
            String name = entry.getKey();
            Set<Class<?>> candidates = entry.getValue();

            if (candidates.size() > 1) {
                if (aliases.getExact().containsKey(name)) {
                    continue;
                }

                if (options.getAmbiguousAliasPolicy() == AmbiguousAliasPolicy.EAGER) {
                    throw new AmbiguousAliasException(name, candidates);
                }

                producers.remove(name);
                LOGGER.fine(() -> "Skipping ambiguous name '" + name + "' shared by " + candidates.size() + " types");
                continue;
            }

            Class<?> target = candidates.iterator().next();
            producers.put(name, getTargetProducer(producers, name, target));
        }
    }

    private void includeExactAliases(Map<Object, Producer> producers) {
        for (Map.Entry<String, Class<?>> entry : aliases.getExact().entrySet()) {
            producers.put(entry.getKey(), getTargetProducer(producers, entry.getKey(), entry.getValue()));
        }
    }

    private static Producer getTargetProducer(Map<Object, Producer> producers, String name, Class<?> target) {
        Producer producer = producers.get(target);

        if (producer == null) {
            throw new AliasConfigurationException(name, target);
        }

        return producer;
    }

    private void bind(@NotNull Class<?> key, @NotNull Resolver resolver) {
        Objects.requireNonNull(key, "key");

        if (registrations.containsKey(key)) {
            throw new OverridingServiceException(key, resolver);
        }

        registrations.put(key, new Registration(key, resolver));
        provider = null;

        if (!isStrict()) {
            aliases.infer(key);
        }

        LOGGER.finer(() -> "Registered " + key.getName() + " as " + resolver);
    }

    private @NotNull Container addSelf(@NotNull Class<?> type, @NotNull ServiceLifetime lifetime) {
        Objects.requireNonNull(type, "type");

        bind(type, new DynamicResolver(type, type, lifetime, this));
        return this;
    }

    private void checkNotStrict() {
        if (isStrict()) {
            throw new InvalidOperationInStrictModeException();
        }
    }
}
