package dev.fumaz.sprout.descriptor;

import dev.fumaz.sprout.container.Container;
import dev.fumaz.sprout.container.ContainerOptions;
import dev.fumaz.sprout.container.ServiceProvider;
import dev.fumaz.sprout.exception.UnsupportedUnionTypeException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DescriptorTableTest {

    @Test
    void buildsServicesFromDeclaredDescriptors() {
        DescriptorTable table = new DescriptorTable()
                .put(TypeDescriptor.ofNoDependencies(Store.class, arguments -> new Store("declared")))
                .put(TypeDescriptor.ofConstructor(Shop.class, List.of(Dependency.untyped("store")),
                        arguments -> new Shop((Store) arguments[0])));

        ServiceProvider provider = new Container(ContainerOptions.builder().descriptorProvider(table).build())
                .addSingleton(Store.class)
                .addTransient(Shop.class)
                .build();

        Shop shop = provider.get(Shop.class);

        assertEquals("declared", shop.store.name);
        assertSame(provider.get(Store.class), shop.store);
    }

    @Test
    void fallsBackToReflection() {
        DescriptorTable table = new DescriptorTable();

        TypeDescriptor descriptor = table.describe(Shop.class);

        assertEquals(TypeDescriptor.Style.CONSTRUCTOR, descriptor.getStyle());
        assertEquals(List.of(Dependency.of("store", Store.class)), descriptor.getDependencies());
    }

    @Test
    void rejectsDuplicateDescriptors() {
        DescriptorTable table = new DescriptorTable()
                .put(TypeDescriptor.ofNoDependencies(Store.class, arguments -> new Store("first")));

        assertTrue(table.contains(Store.class));
        assertThrows(IllegalArgumentException.class,
                () -> table.put(TypeDescriptor.ofNoDependencies(Store.class, arguments -> new Store("second"))));
    }

    @Test
    void rejectsUnionDependencies() throws NoSuchMethodException {
        Dependency dependency = Dependency.of("store",
                Optionals.class.getDeclaredMethod("find").getGenericReturnType());

        assertTrue(dependency.isUnion());

        DescriptorTable table = new DescriptorTable()
                .put(TypeDescriptor.ofConstructor(Shop.class, List.of(dependency), arguments -> new Shop(null)));

        Container container = new Container(ContainerOptions.builder().descriptorProvider(table).build())
                .addTransient(Shop.class);

        assertThrows(UnsupportedUnionTypeException.class, container::build);
    }

    @Test
    void treatsObjectTypesAsUntyped() {
        assertTrue(Dependency.of("store", Object.class).isUntyped());
        assertTrue(Dependency.untyped("store").isUntyped());
    }

    static class Store {
        final String name;

        Store(String name) {
            this.name = name;
        }
    }

    static class Shop {
        final Store store;

        Shop(Store store) {
            this.store = store;
        }
    }

    interface Optionals {
        Optional<Store> find();
    }
}
