package works.order.mixins;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.order.UniqueObjectRegistry;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.DuplicateObjectException;
import works.order.exceptions.InvalidTypeException;
import works.order.util.SelectionDialect;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CopierTest {
	UniqueObjectRegistry registry;
	Sample original;

	@BeforeEach
	void setupSample() {
		registry = UniqueObjectRegistry.builder().name("CopierTest").build();
		original = new Sample(registry, Map.of(
			"name", "original",
			"isData", true,
			"selection", "x > 1",
			"selectionMode", "numexpr",
			"tags", List.of("foo", "bar"),
			"aux", Map.of("key", List.of(1, 2))));
	}

	@Test
	void copy_copiesAttributes() {
		Sample copy = original.copy(Map.of("name", "copy"));
		assertEquals("copy", copy.name());
		assertEquals(1, copy.id());
		assertSame(registry, copy.registry());
		assertTrue(copy.isData());
		assertEquals("(x > 1)", copy.selection());
		assertEquals(SelectionDialect.NUMEXPR, copy.selectionMode());
		assertThat(copy.tags(), contains("foo", "bar"));
		assertEquals(List.of(1, 2), copy.getAux("key"));
		assertEquals("original", copy.label());
	}

	@Test
	void copy_isDeep() {
		Sample copy = original.copy(Map.of("name", "copy"));
		assertNotSame(original.getAux("key"), copy.getAux("key"));
		copy.setAux("other", 1);
		copy.addTag("baz");
		assertFalse(original.hasAux("other"));
		assertFalse(original.hasTag("baz"));
	}

	@Test
	void copyWithoutNewName_collides() {
		assertThrows(DuplicateObjectException.class, () -> original.copy(Map.of("name", "original")));
		assertEquals(1, registry.index(Sample.class).size());
	}

	@Test
	void copy_canTargetAnotherContext() {
		Sample copy = original.copier().override("name", "original").override("context", "other").copy();
		assertEquals(List.of("other"), copy.contexts());
	}

	@Test
	void overrides_winOverCallbacks() {
		Sample copy = original.copier()
			.callback((source, attributes) -> attributes.put("name", source.name() + "_updated"))
			.callback((source, attributes) -> attributes.put("isData", false))
			.override("isData", true)
			.copy();
		assertEquals("original_updated", copy.name());
		assertTrue(copy.isData());
	}

	@Test
	void attributes_restrictWhatIsCopied() {
		Sample copy = original.copier()
			.attributes("tags")
			.override("name", "copy")
			.copy();
		assertThat(copy.tags(), contains("foo", "bar"));
		assertFalse(copy.isData());
		assertEquals("1", copy.selection());
	}

	@Test
	void unknownAttribute_throws() {
		assertThrows(ConfigurationException.class, () -> original.copier().attributes("nonexistent"));
	}

	@Test
	void nullCallback_throws() {
		assertThrows(InvalidTypeException.class, () -> original.copier().callback(null));
	}

	@Test
	void callbacks_replaceDefaults() {
		CopySpec<Sample> spec = CopySpec.<Sample>builder()
			.attribute("tags", Sample::tags)
			.callback((source, attributes) -> attributes.put("name", "fromDefault"))
			.build();
		Sample viaDefault = Copier.of(original, spec, original.copyFactory()).copy();
		assertEquals("fromDefault", viaDefault.name());

		Sample viaReplacement = Copier.of(original, spec, original.copyFactory())
			.callbacks(List.<CopyCallback<Sample>>of((source, attributes) -> attributes.put("name", "fromReplacement")))
			.copy();
		assertEquals("fromReplacement", viaReplacement.name());
	}

	@Test
	void target_producesOtherType() {
		Map<String, Object> draft = original.copier()
			.<Map<String, Object>>target(attributes -> attributes)
			.override("name", "unused")
			.copy();
		assertThat(draft.keySet(), contains("isData", "label", "selectionMode", "selection", "tags", "aux", "name"));
		assertEquals(1, registry.index(Sample.class).size());
	}

	@Test
	void declaringAttributeTwice_throws() {
		CopySpec.Builder<Sample> builder = CopySpec.<Sample>builder().attribute("tags", Sample::tags);
		assertThrows(ConfigurationException.class, () -> builder.attribute("tags", Sample::tags));
	}
}
