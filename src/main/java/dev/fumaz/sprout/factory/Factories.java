package dev.fumaz.sprout.factory;

import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.exception.InvalidFactoryException;
import dev.fumaz.sprout.exception.MissingTypeException;
import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.exception.SproutException;
import dev.fumaz.sprout.reflection.Reflections;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;

/**
 * Adapts factory methods to {@link ServiceFactory}, inspecting their parameters once.
 */
public final class Factories {

    private Factories() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Returns the type a factory method produces: the explicit type if given, else the method's return type.
     *
     * @throws MissingTypeException if no type is given and the method returns {@code void}
     */
    public static @NotNull Class<?> returnType(@NotNull Method method, @Nullable Class<?> explicitType) {
        if (explicitType != null) {
            return explicitType;
        }

        Class<?> declared = method.getReturnType();

        if (declared == void.class || declared == Void.class) {
            throw new MissingTypeException();
        }

        return declared;
    }

    /**
     * Wraps a factory method taking no parameters, an {@link ActivationScope}, or an {@link ActivationScope} and the
     * activating {@link Class}.
     *
     * @param method     the factory method
     * @param target     the receiver, {@code null} for static methods
     * @param returnType the type the factory is registered for, used in error messages
     * @throws InvalidFactoryException if the method has any other signature
     */
    public static @NotNull ServiceFactory<Object> fromMethod(@NotNull Method method,
                                                             @Nullable Object target,
                                                             @NotNull Class<?> returnType) {
        Class<?>[] parameters = method.getParameterTypes();

        if (parameters.length > 2 || method.isVarArgs()) {
            throw new InvalidFactoryException(returnType);
        }

        if (parameters.length >= 1 && !parameters[0].isAssignableFrom(ActivationScope.class)) {
            throw new InvalidFactoryException(returnType);
        }

        if (parameters.length == 2 && !parameters[1].isAssignableFrom(Class.class)) {
            throw new InvalidFactoryException(returnType);
        }

        Invoker invoker = Reflections.methodInvoker(method, target);

        switch (parameters.length) {
            case 0:
                return (scope, activatingType) -> invoke(returnType, invoker, new Object[0]);
            case 1:
                return (scope, activatingType) -> invoke(returnType, invoker, new Object[]{scope});
            default:
                return (scope, activatingType) -> invoke(returnType, invoker, new Object[]{scope, activatingType});
        }
    }

    private static Object invoke(Class<?> type, Invoker invoker, Object[] arguments) {
        try {
            return invoker.invoke(arguments);
        } catch (SproutException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new ProvisionException("Factory for " + type.getName() + " failed", e);
        }
    }
}
