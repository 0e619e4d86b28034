package dev.fumaz.sprout.container;

import dev.fumaz.sprout.exception.CannotResolveTypeException;
import dev.fumaz.sprout.exception.OverridingServiceException;
import dev.fumaz.sprout.exception.ProvisionException;
import dev.fumaz.sprout.scope.ActivationScope;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceProviderTest {

    @Test
    void setsServicesAfterBuilding() {
        ServiceProvider provider = new Container().build();
        Settings settings = new Settings("production");

        provider.set(Settings.class, settings);
        provider.set("environment", "production");

        assertTrue(provider.contains(Settings.class));
        assertTrue(provider.contains("Settings"));
        assertSame(settings, provider.get(Settings.class));
        assertSame(settings, provider.get("Settings"));
        assertEquals("production", provider.get("environment"));
    }

    @Test
    void rejectsSettingKnownKeys() {
        ServiceProvider provider = new Container()
                .addSingleton(Greeter.class)
                .build();

        assertThrows(OverridingServiceException.class, () -> provider.set(Greeter.class, new Greeter()));
        assertThrows(OverridingServiceException.class, () -> provider.set("greeter", new Greeter()));
        assertThrows(IllegalArgumentException.class, () -> provider.set(42, new Greeter()));
    }

    @Test
    void returnsDefaultsForUnknownKeys() {
        ServiceProvider provider = new ServiceProvider();
        Settings fallback = new Settings("fallback");

        assertSame(fallback, provider.getOrDefault(Settings.class, null, fallback));
        assertNull(provider.getOrDefault(Settings.class, null, null));
        assertFalse(provider.contains(Settings.class));
        assertThrows(CannotResolveTypeException.class, () -> provider.get(Settings.class));
    }

    @Test
    void seededScopeValuesTakePrecedence() {
        ServiceProvider provider = new Container()
                .addInstance(new Settings("registered"))
                .build();

        Settings seeded = new Settings("seeded");
        ActivationScope scope = provider.createScope(Map.of(Settings.class, seeded, "request", "GET /cats"));

        assertSame(seeded, provider.get(Settings.class, scope));
        assertSame(seeded, scope.get(Settings.class));
        assertEquals("GET /cats", scope.get("request"));
        assertEquals("registered", provider.get(Settings.class).environment);
    }

    @Test
    void executesMethodsWithResolvedArguments() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addSingleton(Greeter.class)
                .addInstance(new Settings("test"))
                .build();

        Method method = ServiceProviderTest.class.getDeclaredMethod("greet", Greeter.class, Object.class);

        String greeting = provider.exec(method, null);

        assertEquals("Hello from test", greeting);
    }

    @Test
    void executesMethodsWithScopedValues() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addSingleton(Greeter.class)
                .build();

        Method method = ServiceProviderTest.class.getDeclaredMethod("greet", Greeter.class, Object.class);

        String greeting = provider.exec(method, null, Map.of("settings", new Settings("scope")));

        assertEquals("Hello from scope", greeting);
    }

    @Test
    void memoizesExecutorsOfStaticMethods() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addSingleton(Greeter.class)
                .addInstance(new Settings("static"))
                .build();

        Method method = ServiceProviderTest.class.getDeclaredMethod("greet", Greeter.class, Object.class);
        ServiceExecutor<String> executor = provider.getExecutor(method, null);

        assertSame(executor, provider.getExecutor(method, null));
        assertEquals("Hello from static", executor.execute());
    }

    @Test
    void doesNotRetainReceiversOfInstanceMethods() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addSingleton(Greeter.class)
                .build();

        Method method = Greeter.class.getDeclaredMethod("greet", Settings.class);
        Greeter greeter = new Greeter();
        ServiceExecutor<String> executor = provider.getExecutor(method, greeter);

        assertNotSame(executor, provider.getExecutor(method, greeter));
        assertEquals("Hello from exec", executor.execute(Map.of(Settings.class, new Settings("exec"))));
        assertEquals("Hello from again", executor.execute(Map.of(Settings.class, new Settings("again"))));
    }

    @Test
    void disposesScopedServicesAfterExecuting() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addScoped(Connection.class)
                .build();

        Method method = ServiceProviderTest.class.getDeclaredMethod("query", Connection.class);
        Connection connection = provider.exec(method, null);

        assertTrue(connection.closed);
    }

    @Test
    void executesAsynchronousMethods() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addScoped(Connection.class)
                .build();

        Method method = ServiceProviderTest.class.getDeclaredMethod("queryAsync", Connection.class);
        CompletableFuture<Connection> future = provider.execAsync(method, null, null);

        Connection connection = future.join();

        assertTrue(connection.closed, "scope should be disposed once the stage completes");
    }

    @Test
    void rejectsAsynchronousExecutionOfSynchronousMethods() throws NoSuchMethodException {
        ServiceProvider provider = new Container()
                .addScoped(Connection.class)
                .build();

        Method method = ServiceProviderTest.class.getDeclaredMethod("query", Connection.class);

        assertThrows(IllegalArgumentException.class, () -> provider.execAsync(method, null, null));
    }

    @Test
    void wrapsExceptionsThrownByExecutedMethods() throws NoSuchMethodException {
        ServiceProvider provider = new ServiceProvider();
        Method method = ServiceProviderTest.class.getDeclaredMethod("fail");

        ProvisionException exception = assertThrows(ProvisionException.class, () -> provider.exec(method, null));

        assertInstanceOf(UnsupportedOperationException.class, exception.getCause());
    }

    private static String greet(Greeter greeter, Object settings) {
        return greeter.greet((Settings) settings);
    }

    private static Connection query(Connection connection) {
        return connection;
    }

    private static CompletionStage<Connection> queryAsync(Connection connection) {
        return CompletableFuture.completedFuture(connection);
    }

    private static Object fail() {
        throw new UnsupportedOperationException("fail");
    }

    static class Settings {
        final String environment;

        Settings(String environment) {
            this.environment = environment;
        }
    }

    static class Greeter {
        String greet(Settings settings) {
            return "Hello from " + settings.environment;
        }
    }

    static class Connection implements AutoCloseable {
        boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }
}
