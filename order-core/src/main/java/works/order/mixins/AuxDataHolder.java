package works.order.mixins;

import java.util.Map;

/**
 * An object carrying {@link AuxData}.
 */
public interface AuxDataHolder {
	AuxData auxState();

	default Map<String, Object> aux() {
		return auxState().asMap();
	}

	default <V> V setAux(String key, V value) {
		return auxState().set(key, value);
	}

	default Object getAux(String key) {
		return auxState().get(key);
	}

	default Object getAux(String key, Object defaultValue) {
		return auxState().get(key, defaultValue);
	}

	default boolean hasAux(String key) {
		return auxState().has(key);
	}

	default void removeAux(String key) {
		auxState().remove(key);
	}

	default void clearAux() {
		auxState().clear();
	}
}
