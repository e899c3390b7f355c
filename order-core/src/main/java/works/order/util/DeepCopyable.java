package works.order.util;

/**
 * A mutable value that knows how to produce an independent copy of itself.
 *
 * @see DeepCopy
 */
public interface DeepCopyable<T> {
	T deepCopy();
}
