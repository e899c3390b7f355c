package works.order;

import java.util.ArrayList;
import java.util.List;
import works.order.exceptions.ConfigurationException;
import works.order.util.Values;

import static works.order.UniqueObjectRegistry.DEFAULT_CONTEXT;

/**
 * Validation of context names as given to {@link UniqueObject} constructors.
 */
final class ContextNames {
	private ContextNames() { }

	/**
	 * @param raw null for the default context, a single name, or a collection or array of names
	 * @return the distinct names in the given order
	 */
	static List<String> parse(Object raw) {
		if (raw == null) {
			return List.of(DEFAULT_CONTEXT);
		}
		List<Object> candidates = Values.asList(raw);
		if (candidates.isEmpty()) {
			throw new ConfigurationException("At least one context is required");
		}
		List<String> result = new ArrayList<>(candidates.size());
		for (Object candidate : candidates) {
			if (!(candidate instanceof String name)) {
				throw new ConfigurationException("Context name must be a string, not " + candidate);
			}
			validate(name);
			if (result.contains(name)) {
				throw new ConfigurationException("Context \"" + name + "\" is given more than once");
			}
			result.add(name);
		}
		return List.copyOf(result);
	}

	static String validate(String name) {
		if (name == null || name.isBlank()) {
			throw new ConfigurationException("Context name can't be blank");
		} else if (!name.strip().equals(name)) {
			throw new ConfigurationException("Context name can't start or end with whitespace: \"" + name + "\"");
		}
		return name;
	}
}
