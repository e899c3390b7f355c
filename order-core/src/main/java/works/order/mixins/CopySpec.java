package works.order.mixins;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.InvalidTypeException;

import static java.util.Objects.requireNonNull;

/**
 * The attributes a class copies by default, with a getter for each,
 * and the callbacks it runs by default. Declared once per class.
 */
public final class CopySpec<S> {
	private final Map<String, Function<? super S, ?>> attributes;
	private final List<CopyCallback<? super S>> callbacks;

	private CopySpec(Map<String, Function<? super S, ?>> attributes, List<CopyCallback<? super S>> callbacks) {
		this.attributes = attributes;
		this.callbacks = callbacks;
	}

	public static <S> Builder<S> builder() {
		return new Builder<>();
	}

	public List<String> attributeNames() {
		return List.copyOf(attributes.keySet());
	}

	public boolean hasAttribute(String name) {
		return attributes.containsKey(name);
	}

	public List<CopyCallback<? super S>> callbacks() {
		return callbacks;
	}

	/**
	 * @throws ConfigurationException if {@code attribute} was not declared
	 */
	Object read(S source, String attribute) {
		Function<? super S, ?> getter = attributes.get(attribute);
		if (getter == null) {
			throw new ConfigurationException("Attribute \"" + attribute + "\" of " + source.getClass().getSimpleName() + " can't be copied");
		}
		return getter.apply(source);
	}

	public static class Builder<S> {
		private final Map<String, Function<? super S, ?>> attributes = new LinkedHashMap<>();
		private final List<CopyCallback<? super S>> callbacks = new ArrayList<>();

		Builder() { }

		public Builder<S> attribute(String name, Function<? super S, ?> getter) {
			if (attributes.put(requireNonNull(name), requireNonNull(getter)) != null) {
				throw new ConfigurationException("Copy attribute \"" + name + "\" declared twice");
			}
			return this;
		}

		public Builder<S> callback(CopyCallback<? super S> callback) {
			if (callback == null) {
				throw InvalidTypeException.of("copy callback", null);
			}
			callbacks.add(callback);
			return this;
		}

		public CopySpec<S> build() {
			return new CopySpec<>(new LinkedHashMap<>(attributes), List.copyOf(callbacks));
		}
	}
}
