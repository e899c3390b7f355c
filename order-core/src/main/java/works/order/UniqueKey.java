package works.order;

import static java.util.Objects.requireNonNull;

/**
 * The composite identity of a {@link UniqueObject} within one index.
 */
public record UniqueKey(String name, int id) {
	public UniqueKey {
		requireNonNull(name);
	}

	@Override
	public String toString() {
		return "(" + name + ", " + id + ")";
	}
}
