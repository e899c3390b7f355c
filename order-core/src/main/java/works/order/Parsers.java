package works.order;

import java.util.LinkedHashMap;
import java.util.Map;
import org.pcollections.OrderedPSet;
import org.pcollections.PSet;
import works.order.exceptions.InvalidTypeException;
import works.order.exceptions.InvalidValueException;
import works.order.util.Values;

/**
 * The parsers shared by most {@link TypedProperty typed properties}.
 * The {@code what} argument names the value in error messages.
 */
public final class Parsers {
	private Parsers() { }

	public static <O> Parser<O, String> string(String what) {
		return (owner, raw) -> {
			if (raw instanceof String s) {
				return s;
			}
			throw InvalidTypeException.of(what, raw);
		};
	}

	public static <O> Parser<O, String> nonEmptyString(String what) {
		Parser<O, String> string = string(what);
		return (owner, raw) -> {
			String s = string.parse(owner, raw);
			if (s.isEmpty()) {
				throw new InvalidValueException(what + " must not be empty");
			}
			return s;
		};
	}

	public static <O> Parser<O, String> nullableString(String what) {
		return Parser.nullable(string(what));
	}

	public static <O> Parser<O, Boolean> bool(String what) {
		return (owner, raw) -> {
			if (raw instanceof Boolean b) {
				return b;
			}
			throw InvalidTypeException.of(what, raw);
		};
	}

	/**
	 * Accepts one string or a collection or array of strings.
	 */
	public static <O> Parser<O, PSet<String>> stringSet(String what) {
		return (owner, raw) -> {
			if (raw instanceof String || Values.isSequence(raw)) {
				PSet<String> result = OrderedPSet.empty();
				for (Object element : Values.asList(raw)) {
					if (!(element instanceof String s)) {
						throw InvalidTypeException.of(what + " element", element);
					}
					result = result.plus(s);
				}
				return result;
			}
			throw InvalidTypeException.of(what, raw);
		};
	}

	/**
	 * Accepts any map with string keys, copied into a new insertion-ordered map.
	 */
	public static <O> Parser<O, Map<String, Object>> orderedMap(String what) {
		return (owner, raw) -> {
			if (!(raw instanceof Map<?, ?> map)) {
				throw InvalidTypeException.of(what, raw);
			}
			Map<String, Object> result = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String key)) {
					throw InvalidTypeException.of(what + " key", entry.getKey());
				}
				result.put(key, entry.getValue());
			}
			return result;
		};
	}
}
