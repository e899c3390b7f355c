package works.order.mixins;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.order.exceptions.InvalidTypeException;
import works.order.exceptions.ObjectNotFoundException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuxDataTest {

	@Test
	void setAndGet_work() {
		AuxData aux = new AuxData();
		assertEquals(42, aux.set("answer", 42));
		assertEquals(42, aux.get("answer"));
		assertTrue(aux.has("answer"));
		assertEquals("fallback", aux.get("missing", "fallback"));
	}

	@Test
	void getMissing_throws() {
		assertThrows(ObjectNotFoundException.class, () -> new AuxData().get("missing"));
	}

	@Test
	void nullValue_isPresent() {
		AuxData aux = new AuxData();
		aux.set("nothing", null);
		assertTrue(aux.has("nothing"));
		assertNull(aux.get("nothing"));
	}

	@Test
	void remove_toleratesMissing() {
		AuxData aux = new AuxData(Map.of("a", 1));
		aux.remove("missing");
		aux.remove("a");
		assertFalse(aux.has("a"));
	}

	@Test
	void entries_keepInsertionOrder() {
		Map<String, Object> initial = new LinkedHashMap<>();
		initial.put("z", 1);
		initial.put("a", 2);
		AuxData aux = new AuxData(initial);
		aux.set("m", 3);
		assertThat(aux.asMap().keySet(), contains("z", "a", "m"));
	}

	@Test
	void constructor_copiesInput() {
		Map<String, Object> initial = new LinkedHashMap<>();
		initial.put("a", 1);
		AuxData aux = new AuxData(initial);
		initial.put("b", 2);
		assertFalse(aux.has("b"));
	}

	@Test
	void asMap_isReadOnly() {
		AuxData aux = new AuxData(Map.of("a", 1));
		assertThrows(UnsupportedOperationException.class, () -> aux.asMap().put("b", 2));
	}

	@Test
	void replaceWithNonMap_throws() {
		AuxData aux = new AuxData(Map.of("a", 1));
		assertThrows(InvalidTypeException.class, () -> aux.replace(List.of("a")));
		assertThrows(InvalidTypeException.class, () -> aux.replace(Map.of(1, "a")));
		assertTrue(aux.has("a"));
	}

	@Test
	void clear_removesAll() {
		AuxData aux = new AuxData(Map.of("a", 1, "b", 2));
		aux.clear();
		assertTrue(aux.asMap().isEmpty());
	}
}
