package dev.fumaz.sprout.resolver;

import dev.fumaz.sprout.bind.Registration;
import dev.fumaz.sprout.bind.Registry;
import dev.fumaz.sprout.bind.ServiceLifetime;
import dev.fumaz.sprout.descriptor.Dependency;
import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.descriptor.MemberWriter;
import dev.fumaz.sprout.descriptor.TypeDescriptor;
import dev.fumaz.sprout.exception.CannotResolveParameterException;
import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.exception.SproutException;
import dev.fumaz.sprout.exception.UnsupportedUnionTypeException;
import dev.fumaz.sprout.factory.ServiceFactory;
import dev.fumaz.sprout.producer.ArgsTypeProducer;
import dev.fumaz.sprout.producer.Producer;
import dev.fumaz.sprout.producer.Producers;
import dev.fumaz.sprout.producer.ScopedArgsTypeProducer;
import dev.fumaz.sprout.producer.ScopedTypeProducer;
import dev.fumaz.sprout.producer.SingletonTypeProducer;
import dev.fumaz.sprout.producer.TypeProducer;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Resolves a concrete type by inspecting its dependencies and compiling a producer for each of them.
 * <p>
 * A dependency is matched to a registration by its declared type, or, when it has none, by its name through the
 * exact and then the inferred aliases. Dependencies are compiled depth-first within the same
 * {@link ResolutionContext}; meeting a type that is still being compiled is a circular dependency.
 */
public final class DynamicResolver implements Resolver {

    private static final Logger LOGGER = Logger.getLogger(DynamicResolver.class.getName());

    private final @NotNull Class<?> key;
    private final @NotNull Class<?> concreteType;
    private final @NotNull ServiceLifetime lifetime;
    private final @NotNull Registry registry;

    public DynamicResolver(@NotNull Class<?> key,
                           @NotNull Class<?> concreteType,
                           @NotNull ServiceLifetime lifetime,
                           @NotNull Registry registry) {
        if (concreteType.isInterface() || Modifier.isAbstract(concreteType.getModifiers())) {
            throw new IllegalArgumentException("Type " + concreteType.getName() + " is abstract and cannot be activated");
        }

        this.key = Objects.requireNonNull(key, "key");
        this.concreteType = concreteType;
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public @NotNull Class<?> getConcreteType() {
        return concreteType;
    }

    @Override
    public @NotNull ServiceLifetime getLifetime() {
        return lifetime;
    }

    @Override
    public @NotNull Producer resolve(@NotNull ResolutionContext context) {
        context.enter(key);

        try {
            TypeDescriptor descriptor = registry.getDescriptorProvider().describe(concreteType);

            LOGGER.finer(() -> "Compiling " + lifetime + " " + concreteType.getName() + " for "
                    + key.getName() + " with dependencies " + descriptor.getDependencies());

            if (descriptor.getStyle() == TypeDescriptor.Style.FIELDS) {
                return resolveByFields(context, descriptor);
            }

            return resolveByConstructor(context, descriptor);
        } finally {
            context.exit(key);
        }
    }

    private Producer resolveByConstructor(ResolutionContext context, TypeDescriptor descriptor) {
        Invoker invoker = descriptor.getInvoker();

        if (descriptor.getDependencies().isEmpty()) {
            switch (lifetime) {
                case SINGLETON:
                    return new SingletonTypeProducer(concreteType, invoker);
                case SCOPED:
                    return new ScopedTypeProducer(key, concreteType, invoker);
                default:
                    return new TypeProducer(concreteType, invoker);
            }
        }

        Producer[] arguments = resolveDependencies(context, descriptor.getDependencies());

        switch (lifetime) {
            case SINGLETON:
                return new SingletonTypeProducer(concreteType, invoker, arguments);
            case SCOPED:
                return new ScopedArgsTypeProducer(key, concreteType, invoker, arguments);
            default:
                return new ArgsTypeProducer(concreteType, invoker, arguments);
        }
    }

    private Producer resolveByFields(ResolutionContext context, TypeDescriptor descriptor) {
        List<Dependency> fields = descriptor.getDependencies();
        Producer[] producers = resolveDependencies(context, fields);
        String[] names = fields.stream().map(Dependency::getName).toArray(String[]::new);
        Invoker invoker = descriptor.getInvoker();
        MemberWriter writer = descriptor.getWriter();
        Class<?> type = concreteType;

        ServiceFactory<Object> factory = (scope, activatingType) -> {
            Object instance = Producers.invoke(type, invoker, new Object[0]);

            if (instance == null) {
                throw new ProvisionException("Constructor of " + type.getName() + " produced no instance");
            }

            for (int i = 0; i < producers.length; i++) {
                Object value = producers[i].produce(scope, type);

                try {
                    writer.write(instance, i, value);
                } catch (SproutException | Error e) {
                    throw e;
                } catch (Throwable e) {
                    throw new ProvisionException("Failed to assign " + names[i] + " of " + type.getName(), e);
                }
            }

            return instance;
        };

        return new FactoryResolver(key, concreteType, factory, lifetime).resolve(context);
    }

    private Producer[] resolveDependencies(ResolutionContext context, List<Dependency> dependencies) {
        Producer[] producers = new Producer[dependencies.size()];

        for (int i = 0; i < producers.length; i++) {
            producers[i] = resolveDependency(context, dependencies.get(i));
        }

        return producers;
    }

    private Producer resolveDependency(ResolutionContext context, Dependency dependency) {
        String name = dependency.getName();
        Type declared = dependency.getType();
        Class<?> target;

        if (declared == null) {
            if (registry.isStrict()) {
                throw new CannotResolveParameterException(name, concreteType);
            }

            target = registry.getAliases().lookup(name, concreteType);
        } else if (dependency.isUnion()) {
            throw new UnsupportedUnionTypeException(name, concreteType);
        } else if (declared instanceof Class) {
            target = (Class<?>) declared;
        } else {
            // generic declarations are never resolved
            throw new CannotResolveParameterException(name, concreteType);
        }

        Registration registration = target == null ? null : registry.getRegistration(target);

        if (registration == null) {
            throw new CannotResolveParameterException(name, concreteType);
        }

        return context.compile(registration);
    }

    @Override
    public String toString() {
        return "<Dynamic " + concreteType.getSimpleName() + " " + lifetime + ">";
    }
}
