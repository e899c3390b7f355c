package works.order.mixins;

import java.util.Map;

/**
 * An object that can produce copies of itself through a {@link Copier}.
 *
 * @param <S> the implementing class
 */
public interface Copyable<S extends Copyable<S>> {
	/**
	 * @return the attributes and callbacks used when none are given explicitly
	 */
	CopySpec<S> copySpec();

	/**
	 * @return the constructor used when no other target is given
	 */
	EntityFactory<S> copyFactory();

	@SuppressWarnings("unchecked")
	default Copier<S, S> copier() {
		return Copier.of((S) this, copySpec(), copyFactory());
	}

	default S copy() {
		return copier().copy();
	}

	default S copy(Map<String, ?> overrides) {
		return copier().overrides(overrides).copy();
	}
}
