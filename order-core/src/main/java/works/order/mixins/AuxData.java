package works.order.mixins;

import java.util.Collections;
import java.util.Map;
import works.order.Parsers;
import works.order.PropertyHolder;
import works.order.PropertyStore;
import works.order.TypedProperty;
import works.order.exceptions.ObjectNotFoundException;

/**
 * Ordered auxiliary key/value storage for data that has no dedicated property.
 */
public final class AuxData implements PropertyHolder {
	static final TypedProperty<AuxData, Map<String, Object>> AUX = TypedProperty.<AuxData, Map<String, Object>>of("aux", Parsers.orderedMap("aux")).notDeletable();

	private final PropertyStore properties = new PropertyStore();

	public AuxData() {
		AUX.initialize(this, Map.of());
	}

	/**
	 * @param aux null, or a map with string keys whose entries are copied in order
	 */
	public AuxData(Object aux) {
		this();
		if (aux != null) {
			replace(aux);
		}
	}

	@Override
	public PropertyStore propertyStore() {
		return properties;
	}

	private Map<String, Object> entries() {
		return AUX.get(this);
	}

	/**
	 * @return {@code value}
	 */
	public <V> V set(String key, V value) {
		entries().put(key, value);
		return value;
	}

	/**
	 * @throws ObjectNotFoundException if there's no entry for {@code key}
	 */
	public Object get(String key) {
		Map<String, Object> entries = entries();
		if (!entries.containsKey(key)) {
			throw new ObjectNotFoundException("No auxiliary data for key \"" + key + "\"");
		}
		return entries.get(key);
	}

	public Object get(String key, Object defaultValue) {
		return entries().getOrDefault(key, defaultValue);
	}

	public boolean has(String key) {
		return entries().containsKey(key);
	}

	/**
	 * Does nothing if there's no entry for {@code key}.
	 */
	public void remove(String key) {
		entries().remove(key);
	}

	public void clear() {
		entries().clear();
	}

	/**
	 * Replaces all entries.
	 */
	public void replace(Object aux) {
		AUX.set(this, aux);
	}

	/**
	 * @return a read-only view
	 */
	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(entries());
	}

	@Override
	public String toString() {
		return "AuxData" + entries();
	}
}
