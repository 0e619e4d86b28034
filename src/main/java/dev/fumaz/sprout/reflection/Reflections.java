package dev.fumaz.sprout.reflection;

import dev.fumaz.sprout.annotation.Inject;
import dev.fumaz.sprout.descriptor.Invoker;
import dev.fumaz.sprout.descriptor.MemberWriter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

public final class Reflections {

    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();
    private static final MethodType SPREAD_TYPE = MethodType.methodType(Object.class, Object[].class);

    private Reflections() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static @NotNull Constructor<?> getInjectableConstructor(@NotNull Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers()) || type.isPrimitive() || type.isArray()) {
            throw new ReflectionException("Cannot instantiate " + type.getName() + ", it is not a concrete class");
        }

        Constructor<?>[] constructors = type.getDeclaredConstructors();
        Constructor<?> annotated = null;
        Constructor<?> zeroArg = null;

        for (Constructor<?> constructor : constructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                if (annotated != null) {
                    throw new ReflectionException("Multiple constructors of " + type.getName()
                            + " are annotated with @Inject");
                }

                annotated = constructor;
            }

            if (constructor.getParameterCount() == 0) {
                zeroArg = constructor;
            }
        }

        if (annotated != null) {
            return annotated;
        }

        if (constructors.length == 1) {
            return constructors[0];
        }

        if (zeroArg != null) {
            return zeroArg;
        }

        throw new ReflectionException("No suitable constructor found for " + type.getName()
                + ", annotate one of its constructors with @Inject");
    }

    /**
     * Returns the parameters that take part in injection, leaving out a trailing varargs parameter.
     */
    public static @NotNull List<Parameter> getInjectableParameters(@NotNull Executable executable) {
        List<Parameter> parameters = new ArrayList<>(Arrays.asList(executable.getParameters()));

        if (executable.isVarArgs()) {
            parameters.remove(parameters.size() - 1);
        }

        return parameters;
    }

    /**
     * Returns the {@link Inject}-annotated instance fields of the type, superclass fields first.
     */
    public static @NotNull List<Field> getInjectableFields(@NotNull Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();

        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }

        List<Field> fields = new ArrayList<>();

        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || !field.isAnnotationPresent(Inject.class)) {
                    continue;
                }

                if (Modifier.isFinal(field.getModifiers())) {
                    throw new ReflectionException("Field " + field.getName() + " of " + current.getName()
                            + " is final and cannot be injected");
                }

                fields.add(field);
            }
        }

        return fields;
    }

    public static @NotNull Invoker constructorInvoker(@NotNull Constructor<?> constructor) {
        try {
            makeAccessible(constructor);
            MethodHandle handle = LOOKUP.unreflectConstructor(constructor);

            return spread(handle, constructor);
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst accessing the constructor " + constructor, e);
        }
    }

    public static @NotNull Invoker methodInvoker(@NotNull Method method, @Nullable Object target) {
        boolean isStatic = Modifier.isStatic(method.getModifiers());

        if (!isStatic && target == null) {
            throw new IllegalArgumentException("Method " + method.getName() + " of "
                    + method.getDeclaringClass().getName() + " is not static and requires a target");
        }

        try {
            makeAccessible(method);
            MethodHandle handle = LOOKUP.unreflect(method);

            if (!isStatic) {
                handle = handle.bindTo(target);
            }

            return spread(handle, method);
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst accessing the method " + method, e);
        }
    }

    /**
     * Returns a writer assigning the fields by their position in the given list, so that fields sharing a name
     * across a class hierarchy stay distinct.
     */
    public static @NotNull MemberWriter fieldWriter(@NotNull List<Field> fields) {
        MethodHandle[] setters = new MethodHandle[fields.size()];

        for (int i = 0; i < setters.length; i++) {
            Field field = fields.get(i);

            try {
                makeAccessible(field);
                setters[i] = LOOKUP.unreflectSetter(field)
                        .asType(MethodType.methodType(void.class, Object.class, Object.class));
            } catch (IllegalAccessException e) {
                throw new ReflectionException("Exception whilst accessing the field " + field, e);
            }
        }

        return (instance, index, value) -> {
            if (index < 0 || index >= setters.length) {
                throw new IndexOutOfBoundsException("No injectable field at position " + index);
            }

            setters[index].invokeExact(instance, value);
        };
    }

    private static Invoker spread(MethodHandle handle, Executable executable) {
        MethodHandle target = handle;
        int count = executable.getParameterCount();

        if (executable.isVarArgs()) {
            Class<?> arrayType = executable.getParameterTypes()[count - 1];

            target = MethodHandles.insertArguments(target.asFixedArity(), count - 1,
                    Array.newInstance(arrayType.getComponentType(), 0));
            count--;
        }

        MethodHandle spreader = target.asSpreader(Object[].class, count).asType(SPREAD_TYPE);

        return arguments -> (Object) spreader.invokeExact(arguments);
    }

    private static void makeAccessible(AccessibleObject object) {
        try {
            object.setAccessible(true);
        } catch (RuntimeException e) {
            throw new ReflectionException("Unable to make " + object + " accessible", e);
        }
    }

}
