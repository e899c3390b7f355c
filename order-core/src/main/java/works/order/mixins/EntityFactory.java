package works.order.mixins;

import java.util.Map;

/**
 * Constructs an object from an attribute map; the target of a {@link Copier}.
 */
@FunctionalInterface
public interface EntityFactory<T> {
	T create(Map<String, Object> attributes);
}
