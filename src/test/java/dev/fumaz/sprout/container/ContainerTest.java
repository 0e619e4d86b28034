package dev.fumaz.sprout.container;

import dev.fumaz.sprout.bind.Registration;
import dev.fumaz.sprout.bind.ServiceLifetime;
import dev.fumaz.sprout.exception.CannotResolveParameterException;
import dev.fumaz.sprout.exception.CannotResolveTypeException;
import dev.fumaz.sprout.exception.OverridingServiceException;
import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.exception.UnsupportedUnionTypeException;
import dev.fumaz.sprout.scope.ActivationScope;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContainerTest {

    @Test
    void rejectsRegisteringTheSameKeyTwice() {
        Container container = new Container().addTransient(Engine.class);

        assertThrows(OverridingServiceException.class, () -> container.addSingleton(Engine.class));
        assertThrows(OverridingServiceException.class, () -> container.addInstance(new Engine()));

        assertEquals(1, container.size());
        assertEquals(ServiceLifetime.TRANSIENT, container.getRegistration(Engine.class).getLifetime());
    }

    @Test
    void transientServicesAreActivatedEveryTime() {
        Container container = new Container()
                .addTransient(Engine.class)
                .addTransient(Car.class);

        ServiceProvider provider = container.build();
        Car first = provider.get(Car.class);
        Car second = provider.get(Car.class);

        assertNotNull(first.engine);
        assertNotSame(first, second);
        assertNotSame(first.engine, second.engine);
    }

    @Test
    void scopedServicesAreSharedWithinAScope() {
        ServiceProvider provider = new Container()
                .addScoped(Engine.class)
                .build();

        ActivationScope scope = provider.createScope();
        ActivationScope other = provider.createScope();

        assertSame(provider.get(Engine.class, scope), provider.get(Engine.class, scope));
        assertNotSame(provider.get(Engine.class, scope), provider.get(Engine.class, other));
        assertNotSame(provider.get(Engine.class), provider.get(Engine.class));
    }

    @Test
    void scopedDependenciesAreSharedByTheirDependents() {
        ServiceProvider provider = new Container()
                .addScoped(Engine.class)
                .addTransient(Car.class)
                .addTransient(Garage.class)
                .build();

        Garage garage = provider.get(Garage.class);

        assertSame(garage.car.engine, garage.engine);
    }

    @Test
    void singletonServicesAreSharedUntilRebuilt() {
        Container container = new Container().addSingleton(Engine.class);
        ServiceProvider provider = container.build();

        Engine engine = provider.get(Engine.class);

        assertSame(engine, provider.get(Engine.class));
        assertSame(engine, provider.get(Engine.class, provider.createScope()));
        assertNotSame(engine, container.build().get(Engine.class));
    }

    @Test
    void singletonDependenciesAreSharedAcrossDependents() {
        ServiceProvider provider = new Container()
                .addSingleton(Engine.class)
                .addTransient(Car.class)
                .build();

        assertSame(provider.get(Car.class).engine, provider.get(Car.class).engine);
        assertSame(provider.get(Engine.class), provider.get(Car.class).engine);
    }

    @Test
    void resolvesNestedTransientDependencies() {
        ServiceProvider provider = new Container()
                .addTransient(Engine.class)
                .addTransient(Car.class)
                .build();

        Car first = provider.get(Car.class);
        Car second = provider.get(Car.class);

        assertInstanceOf(Engine.class, first.engine);
        assertNotSame(first, second);
        assertNotSame(first.engine, second.engine);
    }

    @Test
    void bindsInterfacesToConcreteTypes() {
        ServiceProvider provider = new Container()
                .addInstance(new Settings("conn-str"))
                .addTransient(Repository.class, SqlRepository.class)
                .build();

        Repository repository = provider.get(Repository.class);

        assertInstanceOf(SqlRepository.class, repository);
        assertEquals("conn-str", ((SqlRepository) repository).settings.connection);
    }

    @Test
    void rejectsAbstractConcreteTypes() {
        Container container = new Container();

        assertThrows(IllegalArgumentException.class, () -> container.addTransient(Repository.class));
        assertThrows(IllegalArgumentException.class, () -> container.addSingleton(Repository.class, AbstractRepository.class));
        assertFalse(container.contains(Repository.class));
    }

    @Test
    void registersInstancesUnderTheirDeclaredType() {
        SqlRepository repository = new SqlRepository(new Settings("memory"));
        ServiceProvider provider = new Container()
                .addInstance(repository, Repository.class)
                .build();

        assertSame(repository, provider.get(Repository.class));
        assertFalse(provider.contains(SqlRepository.class));
    }

    @Test
    void failsToBuildWhenADependencyIsMissing() {
        Container container = new Container().addTransient(Car.class);

        CannotResolveParameterException exception = assertThrows(CannotResolveParameterException.class, container::build);

        assertEquals("engine", exception.getParameterName());
        assertSame(Car.class, exception.getDesiredType());
    }

    @Test
    void failsToActivateUnknownKeys() {
        ServiceProvider provider = new Container().build();

        CannotResolveTypeException exception = assertThrows(CannotResolveTypeException.class,
                () -> provider.get(Engine.class));

        assertSame(Engine.class, exception.getKey());
        assertThrows(CannotResolveTypeException.class, () -> provider.get("engine"));
        assertEquals("fallback", provider.getOrDefault("engine", null, "fallback"));
    }

    @Test
    void wrapsExceptionsThrownByConstructors() {
        ServiceProvider provider = new Container().addTransient(Broken.class).build();

        ProvisionException exception = assertThrows(ProvisionException.class, () -> provider.get(Broken.class));

        assertInstanceOf(IllegalStateException.class, exception.getCause());
    }

    @Test
    void rebuildsTheProviderAfterChanges() {
        Container container = new Container().addSingleton(Engine.class);
        ServiceProvider provider = container.getProvider();

        assertSame(provider, container.getProvider());

        container.addTransient(Car.class);

        assertNotSame(provider, container.getProvider());
        assertNotNull(container.resolve(Car.class).engine);
    }

    @Test
    void iteratesRegistrationsInOrder() {
        Container container = new Container()
                .addTransient(Engine.class)
                .addScoped(Car.class)
                .addSingleton(Garage.class);

        List<Class<?>> keys = new ArrayList<>();
        for (Registration registration : container) {
            keys.add(registration.getKey());
        }

        assertEquals(List.of(Engine.class, Car.class, Garage.class), keys);
        assertTrue(container.contains(Car.class));
        assertFalse(container.contains("car"));
    }

    @Test
    void rejectsOptionalConstructorParameters() {
        Container container = new Container()
                .addTransient(Engine.class)
                .addTransient(OptionalCar.class);

        UnsupportedUnionTypeException exception = assertThrows(UnsupportedUnionTypeException.class, container::build);

        assertEquals("engine", exception.getParameterName());
        assertSame(OptionalCar.class, exception.getDesiredType());
    }

    @Test
    void rejectsGenericConstructorParameters() {
        Container container = new Container()
                .addTransient(Engine.class)
                .addTransient(Fleet.class);

        CannotResolveParameterException exception = assertThrows(CannotResolveParameterException.class, container::build);

        assertFalse(exception instanceof UnsupportedUnionTypeException);
        assertEquals("engines", exception.getParameterName());
        assertSame(Fleet.class, exception.getDesiredType());
    }

    @Test
    void constructsSingletonsOnceUnderConcurrentAccess() throws Exception {
        SlowEngine.constructions.set(0);
        ServiceProvider provider = new Container().addSingleton(SlowEngine.class).build();

        Set<SlowEngine> engines = activateConcurrently(() -> provider.get(SlowEngine.class));

        assertEquals(1, SlowEngine.constructions.get());
        assertEquals(1, engines.size());
    }

    @Test
    void constructsScopedServicesOncePerScopeUnderConcurrentAccess() throws Exception {
        SlowEngine.constructions.set(0);
        ServiceProvider provider = new Container().addScoped(SlowEngine.class).build();
        ActivationScope scope = provider.createScope();

        Set<SlowEngine> engines = activateConcurrently(() -> provider.get(SlowEngine.class, scope));

        assertEquals(1, SlowEngine.constructions.get());
        assertEquals(1, engines.size());
    }

    private static <T> Set<T> activateConcurrently(Callable<T> activation) throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<T>> futures = new ArrayList<>();

            for (int i = 0; i < threads * 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return activation.call();
                }));
            }

            start.countDown();

            Set<T> results = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Future<T> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    static class Engine {
    }

    static class SlowEngine {
        static final AtomicInteger constructions = new AtomicInteger();

        SlowEngine() throws InterruptedException {
            constructions.incrementAndGet();
            Thread.sleep(20);
        }
    }

    static class OptionalCar {
        OptionalCar(Optional<Engine> engine) {
        }
    }

    static class Fleet {
        Fleet(List<Engine> engines) {
        }
    }

    static class Car {
        final Engine engine;

        Car(Engine engine) {
            this.engine = engine;
        }
    }

    static class Garage {
        final Car car;
        final Engine engine;

        Garage(Car car, Engine engine) {
            this.car = car;
            this.engine = engine;
        }
    }

    static class Settings {
        final String connection;

        Settings(String connection) {
            this.connection = connection;
        }
    }

    interface Repository {
    }

    abstract static class AbstractRepository implements Repository {
    }

    static class SqlRepository implements Repository {
        final Settings settings;

        SqlRepository(Settings settings) {
            this.settings = settings;
        }
    }

    static class Broken {
        Broken() {
            throw new IllegalStateException("broken");
        }
    }
}
