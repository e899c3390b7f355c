package works.order;

import works.order.exceptions.ValidationException;

/**
 * Turns a raw value into the value stored by a {@link TypedProperty}.
 * <p>
 * The owner is passed in because some parsers depend on other state of the same
 * object; a selection, for instance, is normalized according to the owner's dialect.
 *
 * @param <O> the owning type
 * @param <T> the parsed value type
 */
@FunctionalInterface
public interface Parser<O, T> {
	/**
	 * @throws ValidationException if {@code raw} is not acceptable
	 */
	T parse(O owner, Object raw);

	/**
	 * @return a parser that lets {@code null} through unchanged and delegates everything else
	 */
	static <O, T> Parser<O, T> nullable(Parser<O, T> parser) {
		return (owner, raw) -> raw == null ? null : parser.parse(owner, raw);
	}
}
