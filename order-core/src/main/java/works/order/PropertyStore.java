package works.order;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The per-instance backing slots of a {@link PropertyHolder}.
 * <p>
 * Slots are keyed by {@link TypedProperty#backingName()}.
 * A slot may hold {@code null}, which is different from the slot being absent.
 * Mutators are package-private so that values only ever arrive through a
 * {@link TypedProperty} parser.
 */
public final class PropertyStore {
	private final Map<String, Object> slots = new LinkedHashMap<>();

	public boolean contains(String backingName) {
		return slots.containsKey(backingName);
	}

	public Set<String> backingNames() {
		return Set.copyOf(slots.keySet());
	}

	Object get(String backingName) {
		return slots.get(backingName);
	}

	void put(String backingName, Object value) {
		slots.put(backingName, value);
	}

	void remove(String backingName) {
		slots.remove(backingName);
	}

	@Override
	public String toString() {
		return "PropertyStore" + slots.keySet();
	}
}
