package works.order.util;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.pcollections.PCollection;
import org.pcollections.PMap;

/**
 * Copies values so that mutating the copy never affects the original.
 * <p>
 * Maps, lists, sets and arrays are copied recursively into mutable insertion-ordered collections.
 * {@link DeepCopyable} values copy themselves.
 * Persistent collections, strings, numbers, booleans, enums and records are shared,
 * as is anything else: those are expected to be immutable.
 */
public final class DeepCopy {
	private DeepCopy() { }

	@SuppressWarnings("unchecked")
	public static <T> T copy(T value) {
		return (T) copyObject(value);
	}

	private static Object copyObject(Object value) {
		if (value == null || value instanceof PCollection<?> || value instanceof PMap<?, ?>) {
			return value;
		} else if (value instanceof DeepCopyable<?> d) {
			return d.deepCopy();
		} else if (value instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(copyObject(k), copyObject(v)));
			return result;
		} else if (value instanceof List<?> list) {
			List<Object> result = new ArrayList<>(list.size());
			list.forEach(v -> result.add(copyObject(v)));
			return result;
		} else if (value instanceof Set<?> set) {
			Set<Object> result = new LinkedHashSet<>();
			set.forEach(v -> result.add(copyObject(v)));
			return result;
		} else if (value instanceof Collection<?> collection) {
			List<Object> result = new ArrayList<>(collection.size());
			collection.forEach(v -> result.add(copyObject(v)));
			return result;
		} else if (value.getClass().isArray()) {
			int length = Array.getLength(value);
			Object result = Array.newInstance(value.getClass().getComponentType(), length);
			for (int i = 0; i < length; i++) {
				Array.set(result, i, copyObject(Array.get(value, i)));
			}
			return result;
		} else {
			return value;
		}
	}
}
