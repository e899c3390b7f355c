package works.order.util;

import java.util.Collection;
import java.util.function.Predicate;

/**
 * How the results of several pattern matches are combined.
 */
public enum MatchMode {
	/**
	 * At least one must match. An empty collection never matches.
	 */
	ANY {
		@Override
		public <T> boolean test(Collection<? extends T> items, Predicate<? super T> predicate) {
			return items.stream().anyMatch(predicate);
		}
	},

	/**
	 * Every one must match. An empty collection always matches.
	 */
	ALL {
		@Override
		public <T> boolean test(Collection<? extends T> items, Predicate<? super T> predicate) {
			return items.stream().allMatch(predicate);
		}
	};

	public abstract <T> boolean test(Collection<? extends T> items, Predicate<? super T> predicate);
}
