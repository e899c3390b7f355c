package works.order.mixins;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.InvalidTypeException;
import works.order.util.DeepCopy;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * Builds a copy of a {@code source} object.
 * <p>
 * {@link #copy()} proceeds in this order:
 * <ol>
 *     <li>each selected attribute (by default all those of the {@link CopySpec}) is read
 *         from the source and {@link DeepCopy deep-copied} into a draft attribute map;</li>
 *     <li>each callback (by default those of the {@link CopySpec}) may modify the draft;</li>
 *     <li>overrides are put into the draft;</li>
 *     <li>the target {@link EntityFactory} constructs the result from the draft.</li>
 * </ol>
 *
 * @param <S> the source type
 * @param <T> the type of the copy
 */
public final class Copier<S, T> {
	private final S source;
	private final CopySpec<S> spec;
	private final EntityFactory<? extends T> target;
	private List<String> attributes;
	private List<CopyCallback<? super S>> callbacks;
	private final Map<String, Object> overrides;

	private Copier(S source, CopySpec<S> spec, EntityFactory<? extends T> target, List<String> attributes, List<CopyCallback<? super S>> callbacks, Map<String, Object> overrides) {
		this.source = source;
		this.spec = spec;
		this.target = target;
		this.attributes = attributes;
		this.callbacks = callbacks;
		this.overrides = overrides;
	}

	public static <S> Copier<S, S> of(S source, CopySpec<S> spec, EntityFactory<S> factory) {
		return new Copier<>(requireNonNull(source), requireNonNull(spec), requireNonNull(factory), null, null, new LinkedHashMap<>());
	}

	/**
	 * @return a copier producing objects from {@code factory} instead, with the same settings
	 */
	public <U> Copier<S, U> target(EntityFactory<? extends U> factory) {
		return new Copier<>(source, spec, requireNonNull(factory), attributes, callbacks, new LinkedHashMap<>(overrides));
	}

	/**
	 * Copies only these attributes instead of all those declared by the {@link CopySpec}.
	 *
	 * @throws ConfigurationException if one of them is not declared
	 */
	public Copier<S, T> attributes(Collection<String> attributes) {
		for (String attribute : attributes) {
			if (!spec.hasAttribute(attribute)) {
				throw new ConfigurationException("Attribute \"" + attribute + "\" of " + source.getClass().getSimpleName() + " can't be copied");
			}
		}
		this.attributes = List.copyOf(attributes);
		return this;
	}

	public Copier<S, T> attributes(String... attributes) {
		return attributes(asList(attributes));
	}

	/**
	 * Runs these callbacks instead of those declared by the {@link CopySpec}.
	 */
	public Copier<S, T> callbacks(Collection<? extends CopyCallback<? super S>> callbacks) {
		List<CopyCallback<? super S>> list = new ArrayList<>(callbacks.size());
		for (CopyCallback<? super S> callback : callbacks) {
			list.add(checkCallback(callback));
		}
		this.callbacks = list;
		return this;
	}

	/**
	 * Adds a callback after those already selected.
	 */
	public Copier<S, T> callback(CopyCallback<? super S> callback) {
		List<CopyCallback<? super S>> list = new ArrayList<>(effectiveCallbacks());
		list.add(checkCallback(callback));
		this.callbacks = list;
		return this;
	}

	private static <C> C checkCallback(C callback) {
		if (callback == null) {
			throw InvalidTypeException.of("copy callback", null);
		}
		return callback;
	}

	public Copier<S, T> override(String attribute, Object value) {
		overrides.put(requireNonNull(attribute), value);
		return this;
	}

	public Copier<S, T> overrides(Map<String, ?> overrides) {
		overrides.forEach(this::override);
		return this;
	}

	private List<CopyCallback<? super S>> effectiveCallbacks() {
		return callbacks == null ? spec.callbacks() : callbacks;
	}

	public T copy() {
		Map<String, Object> draft = new LinkedHashMap<>();
		for (String attribute : attributes == null ? spec.attributeNames() : attributes) {
			draft.put(attribute, DeepCopy.copy(spec.read(source, attribute)));
		}
		for (CopyCallback<? super S> callback : effectiveCallbacks()) {
			callback.beforeCopy(source, draft);
		}
		draft.putAll(overrides);
		return target.create(draft);
	}
}
