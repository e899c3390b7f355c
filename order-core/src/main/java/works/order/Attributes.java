package works.order;

import java.util.Collection;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.order.exceptions.ConfigurationException;

/**
 * Helpers for constructors that take an attribute map, as produced by
 * {@link works.order.mixins.Copier copying}.
 */
public final class Attributes {
	private Attributes() { }

	/**
	 * @throws ConfigurationException if {@code attributes} has a key not in {@code known}
	 */
	public static void requireKnown(Class<?> owner, Map<String, ?> attributes, Collection<String> known) {
		for (String key : attributes.keySet()) {
			if (!known.contains(key)) {
				throw new ConfigurationException("Unknown " + owner.getSimpleName() + " attribute \"" + key + "\"");
			}
		}
	}

	/**
	 * @return the value for {@code key}, or {@code defaultValue} if the key is absent.
	 *   A key that is present with a null value yields null.
	 */
	public static @Nullable Object getOrDefault(Map<String, ?> attributes, String key, Object defaultValue) {
		return attributes.containsKey(key) ? attributes.get(key) : defaultValue;
	}
}
