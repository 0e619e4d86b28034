package dev.fumaz.sprout.producer;

import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.scope.ActivationScope;
import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * Base class for producers that create their instance at most once and then keep returning it.
 * <p>
 * The instance belongs to the producer, not to any scope, so it lives as long as the provider that owns the
 * producer. Creation is guarded by double-checked locking with acquire/release publication.
 */
public abstract class SingletonProducer implements Producer {

    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(SingletonProducer.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull Class<?> type;
    private final Object lock = new Object();
    private Object instance;

    protected SingletonProducer(@NotNull Class<?> type) {
        this.type = type;
    }

    protected abstract Object create(@NotNull ActivationScope scope, @NotNull Class<?> requestingType);

    @Override
    public final @NotNull Object produce(@NotNull ActivationScope scope, @NotNull Class<?> requestingType) {
        Object local = INSTANCE_HANDLE.getAcquire(this);

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = INSTANCE_HANDLE.getAcquire(this);

            if (local == null) {
                local = create(scope, requestingType);

                if (local == null) {
                    throw new ProvisionException("Singleton " + type.getName() + " cannot be null");
                }

                INSTANCE_HANDLE.setRelease(this, local);
            }

            return local;
        }
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }
}
