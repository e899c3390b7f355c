package works.order.mixins;

import java.util.Map;

/**
 * Called by a {@link Copier} after attributes have been copied from the source
 * and before overrides are applied, with the draft attribute map, which it may modify.
 *
 * <pre>{@code
 * CopyCallback<Variable> rename = (source, attributes) -> attributes.put("name", source.name() + "_updated");
 * }</pre>
 */
@FunctionalInterface
public interface CopyCallback<S> {
	void beforeCopy(S source, Map<String, Object> attributes);
}
