package work.lcod.reshape.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import work.lcod.reshape.errors.RegistrationException;

class TypeRegistryTest {
    static class Animal {}

    static class Mammal extends Animal {}

    static class Dog extends Mammal {}

    static class Puppy extends Dog {}

    @Test
    void resolvesMostSpecificRegisteredAncestor() {
        var registry = new TypeRegistry();
        registry.register(Animal.class, (target, key) -> "animal");
        registry.register(Dog.class, (target, key) -> "dog");

        assertSame(Dog.class, registry.resolve(new Dog()).type());
        assertSame(Dog.class, registry.resolve(new Puppy()).type());
        assertSame(Animal.class, registry.resolve(new Mammal()).type());
    }

    @Test
    void registrationOrderDoesNotChangeResolution() {
        var registry = new TypeRegistry();
        registry.register(Dog.class, (target, key) -> "dog");
        registry.register(Animal.class, (target, key) -> "animal");

        assertSame(Dog.class, registry.resolve(new Puppy()).type());
        assertSame(Animal.class, registry.resolve(new Mammal()).type());
    }

    @Test
    void exactRegistrationDoesNotCoverSubtypes() {
        var registry = new TypeRegistry();
        registry.register(Animal.class, (target, key) -> "animal");
        registry.register(Dog.class, (target, key) -> "dog", null, null, true);

        assertSame(Dog.class, registry.resolve(new Dog()).type());
        assertSame(Animal.class, registry.resolve(new Puppy()).type());
    }

    @Test
    void unknownTypesResolveToUnregistered() {
        var registry = new TypeRegistry();
        registry.register(Dog.class, (target, key) -> "dog");

        assertSame(TargetHandler.UNREGISTERED, registry.resolve("text"));
        assertSame(TargetHandler.UNREGISTERED, registry.resolve(null));
        assertFalse(registry.resolve("text").supports(TypeRegistry.READ));
    }

    @Test
    void defaultTypesPreferCollectionsOverPlainObjects() {
        var registry = DefaultTargetTypes.register(new TypeRegistry());

        assertSame(List.class, registry.resolve(new ArrayList<>()).type());
        assertSame(java.util.Map.class, registry.resolve(new HashMap<>()).type());
        assertSame(Iterable.class, registry.resolve(Set.of(1)).type());
        assertSame(Object[].class, registry.resolve(new String[] {"a"}).type());
        assertSame(Object.class, registry.resolve(new Dog()).type());
        assertSame(Void.class, registry.resolve(null).type());
    }

    @Test
    void iterableTypesGetStructuralIteration() throws Exception {
        var registry = DefaultTargetTypes.register(new TypeRegistry());

        assertNotNull(registry.resolve(List.of(1)).iterate());
        assertNotNull(registry.resolve(new Integer[] {1, 2}).iterate());
        assertNull(registry.resolve(new Dog()).iterate());
        assertEquals(List.of(1, 2), registry.resolve(new Integer[] {1, 2}).iterate().iterate(new Integer[] {1, 2}));
    }

    interface Swimmer {}

    interface Runner {}

    static class Triathlete implements Swimmer, Runner {}

    @Test
    void laterRegistrationWinsBetweenUnrelatedMatches() {
        var registry = new TypeRegistry();
        registry.register(Swimmer.class, (target, key) -> "swim");
        registry.register(Runner.class, (target, key) -> "run");

        assertSame(Runner.class, registry.resolve(new Triathlete()).type());

        var reversed = new TypeRegistry();
        reversed.register(Runner.class, (target, key) -> "run");
        reversed.register(Swimmer.class, (target, key) -> "swim");

        assertSame(Swimmer.class, reversed.resolve(new Triathlete()).type());
    }

    @Test
    void primitiveArraysShareTheArrayHandler() throws Exception {
        var registry = DefaultTargetTypes.register(new TypeRegistry());
        var handler = registry.resolve(new int[] {1, 2});

        assertSame(Object[].class, handler.type());
        assertEquals(2, handler.read().read(new int[] {1, 2}, 1));
        assertEquals(List.of(1.5, 2.5), handler.iterate().iterate(new double[] {1.5, 2.5}));
        assertSame(Object.class, new TypeRegistry().register(Object.class, (target, key) -> "any")
            .resolve(new int[0]).type());
    }

    @Test
    void concurrentResolutionSeesWholeRegistrations() throws Exception {
        var executor = Executors.newSingleThreadExecutor();
        try {
            for (int round = 0; round < 500; round++) {
                var registry = new TypeRegistry();
                registry.register(Animal.class, (target, key) -> "animal");
                var writer = executor.submit(() -> registry.register(Dog.class, (target, key) -> "dog"));
                while (!writer.isDone()) {
                    var resolved = registry.resolve(new Puppy()).type();
                    assertTrue(resolved == Animal.class || resolved == Dog.class, String.valueOf(resolved));
                }
                writer.get();
                assertSame(Dog.class, registry.resolve(new Puppy()).type());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void rejectsTypesThatAreBothAncestorAndDescendant() {
        TypeHierarchy tangled = (candidate, ancestor) ->
            (candidate == Dog.class && ancestor == Puppy.class) || ancestor.isAssignableFrom(candidate);
        var registry = new TypeRegistry(tangled);
        registry.register(Puppy.class, (target, key) -> "puppy");
        var before = registry.handlers();

        var error = assertThrows(RegistrationException.class,
            () -> registry.register(Dog.class, (target, key) -> "dog"));

        assertTrue(error.getMessage().contains("both ancestor and descendant"));
        assertEquals(before, registry.handlers());
        assertFalse(registry.handlers().containsKey(Dog.class));
        assertSame(Puppy.class, registry.resolve(new Puppy()).type());
    }

    @Test
    void reregistrationReplacesHandlers() throws Exception {
        var registry = new TypeRegistry();
        registry.register(Dog.class, (target, key) -> "first");
        registry.register(Dog.class, (target, key) -> "second");

        assertEquals("second", registry.resolve(new Puppy()).read().read(new Puppy(), "name"));
        assertEquals(1, registry.handlers().size());
    }

    @Test
    void listsRegisteredTypesPerOperation() {
        var registry = DefaultTargetTypes.register(new TypeRegistry());

        assertEquals(List.of("Iterable", "List", "Map", "Object[]"), registry.registeredTypes(TypeRegistry.ITERATE));
        assertEquals(List.of("List", "Map"), registry.registeredTypes(TypeRegistry.WRITE));
        assertTrue(new TypeRegistry().isEmpty());
    }
}
