package works.order;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.ObjectNotFoundException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.order.UniqueObjectRegistry.DEFAULT_CONTEXT;

class UniqueObjectRegistryTest {
	UniqueObjectRegistry registry;

	@BeforeEach
	void setupRegistry() {
		registry = UniqueObjectRegistry.builder().name("UniqueObjectRegistryTest").build();
	}

	@Test
	void global_isSingleton() {
		assertSame(UniqueObjectRegistry.global(), UniqueObjectRegistry.global());
		assertEquals("global", UniqueObjectRegistry.global().name());
	}

	@Test
	void instanceIDs_differ() {
		UniqueObjectRegistry other = UniqueObjectRegistry.builder().name(registry.name()).build();
		assertNotEquals(registry.instanceID(), other.instanceID());
		assertEquals(IdAllocation.HIGH_WATER_MARK, registry.config().idAllocation());
	}

	@Test
	void index_isCreatedLazilyAndKept() {
		assertTrue(registry.existingIndex(Gadget.class, DEFAULT_CONTEXT).isEmpty());
		UniqueObjectIndex<Gadget> index = registry.index(Gadget.class);
		assertSame(index, registry.index(Gadget.class, DEFAULT_CONTEXT));
		assertSame(index, registry.existingIndex(Gadget.class, DEFAULT_CONTEXT).orElseThrow());
		assertEquals(Set.of(DEFAULT_CONTEXT), registry.contexts());
		assertEquals(List.of(index), registry.indexes(DEFAULT_CONTEXT));
	}

	@Test
	void indexInInvalidContext_throws() {
		assertThrows(ConfigurationException.class, () -> registry.index(Gadget.class, " "));
	}

	@Test
	void get_findsByNameAndId() {
		Gadget g = new Gadget(registry, "g", 3, "ctx");
		assertSame(g, registry.get(Gadget.class, "g", "ctx"));
		assertSame(g, registry.get(Gadget.class, 3, "ctx"));
		assertThrows(ObjectNotFoundException.class, () -> registry.get(Gadget.class, "g"));
		assertThrows(ObjectNotFoundException.class, () -> registry.get(Gadget.class, 4, "ctx"));
	}

	@Test
	void nextId_coversAllContexts() {
		new Gadget(registry, "a", 2, "one");
		new Gadget(registry, "b", 7, "two");
		assertEquals(8, registry.nextId(Gadget.class, List.of("one", "two")));
		assertEquals(3, registry.nextId(Gadget.class, List.of("one", "unknown")));
		assertEquals(0, registry.nextId(Gizmo.class, List.of("one")));
	}

	@Test
	void clearContext_keepsOtherContexts() {
		Gadget shared = new Gadget(registry, "shared", null, List.of("one", "two"));
		Gadget local = new Gadget(registry, "local", null, "one");
		new Gizmo(registry, "gizmo");
		registry.clearContext("one");
		assertTrue(registry.hasContext("one"));
		assertTrue(registry.index(Gadget.class, "one").isEmpty());
		assertFalse(local.isRegistered());
		assertEquals(List.of("two"), shared.contexts());
		assertSame(shared, registry.get(Gadget.class, "shared", "two"));
	}

	@Test
	void removeContext_forgetsIt() {
		new Gadget(registry, "g", null, "one");
		registry.removeContext("one");
		assertFalse(registry.hasContext("one"));
		assertEquals(List.of(), registry.indexes("one"));
		assertThrows(ObjectNotFoundException.class, () -> registry.removeContext("one"));
		assertThrows(ObjectNotFoundException.class, () -> registry.clearContext("one"));
	}

	@Test
	void clear_removesEverything() {
		Gadget a = new Gadget(registry, "a", null, "one");
		Gadget b = new Gadget(registry, "b", null, List.of("two", "three"));
		registry.clear();
		assertEquals(Set.of(), registry.contexts());
		assertFalse(a.isRegistered());
		assertFalse(b.isRegistered());
	}

	@Test
	void registries_areIndependent() {
		UniqueObjectRegistry other = UniqueObjectRegistry.builder().name("other").build();
		Gadget mine = new Gadget(registry, "g");
		Gadget theirs = new Gadget(other, "g");
		assertSame(mine, registry.get(Gadget.class, "g"));
		assertSame(theirs, other.get(Gadget.class, "g"));
		assertEquals(0, theirs.id());
	}
}
