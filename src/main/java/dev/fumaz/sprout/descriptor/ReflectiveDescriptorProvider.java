package dev.fumaz.sprout.descriptor;

import dev.fumaz.sprout.reflection.Reflections;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link DescriptorProvider} backed by Java reflection.
 * <p>
 * Uses the constructor annotated with {@link dev.fumaz.sprout.annotation.Inject}, else the only declared constructor,
 * else the no-argument constructor. When that constructor takes no parameters, the
 * {@link dev.fumaz.sprout.annotation.Inject}-annotated fields become the dependencies instead. A parameter or field
 * declared as {@link Object} is treated as untyped and resolved by name. Descriptors are computed once per class.
 */
public class ReflectiveDescriptorProvider implements DescriptorProvider {

    private static final ClassValue<TypeDescriptor> DESCRIPTORS = new ClassValue<>() {
        @Override
        protected TypeDescriptor computeValue(Class<?> type) {
            return compute(type);
        }
    };

    @Override
    public @NotNull TypeDescriptor describe(@NotNull Class<?> type) {
        return DESCRIPTORS.get(type);
    }

    @Override
    public @NotNull CallableDescriptor describe(@NotNull Method method, @Nullable Object target) {
        List<Dependency> dependencies = new ArrayList<>();

        for (Parameter parameter : Reflections.getInjectableParameters(method)) {
            dependencies.add(Dependency.of(parameter.getName(), parameter.getParameterizedType()));
        }

        return new CallableDescriptor(method.getName(), method.getDeclaringClass(), method.getReturnType(),
                dependencies, Reflections.methodInvoker(method, target));
    }

    private static TypeDescriptor compute(Class<?> type) {
        Constructor<?> constructor = Reflections.getInjectableConstructor(type);
        Invoker invoker = Reflections.constructorInvoker(constructor);
        List<Parameter> parameters = Reflections.getInjectableParameters(constructor);

        if (parameters.isEmpty()) {
            List<Field> fields = Reflections.getInjectableFields(type);

            if (fields.isEmpty()) {
                return TypeDescriptor.ofNoDependencies(type, invoker);
            }

            List<Dependency> dependencies = new ArrayList<>(fields.size());

            for (Field field : fields) {
                dependencies.add(Dependency.of(field.getName(), field.getGenericType()));
            }

            return TypeDescriptor.ofFields(type, dependencies, invoker, Reflections.fieldWriter(fields));
        }

        List<Dependency> dependencies = new ArrayList<>(parameters.size());

        for (Parameter parameter : parameters) {
            dependencies.add(Dependency.of(parameter.getName(), parameter.getParameterizedType()));
        }

        return TypeDescriptor.ofConstructor(type, dependencies, invoker);
    }
}
