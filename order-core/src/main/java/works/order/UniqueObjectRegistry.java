package works.order;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.DuplicateObjectException;
import works.order.exceptions.ObjectNotFoundException;
import works.order.logging.MappedDiagnosticContext;
import works.order.logging.MappedDiagnosticContext.MDCScope;

import static java.util.Objects.requireNonNull;
import static java.util.UUID.randomUUID;

/**
 * Holds the {@link UniqueObjectIndex indexes} of every context:
 * one index per context and per {@link UniqueObject} class.
 * <p>
 * Contexts and indexes are created lazily as objects are registered,
 * and are only discarded by {@link #removeContext} or {@link #clear}.
 * <p>
 * Applications that don't care about isolation can use the process-wide {@link #global()} registry.
 * Tests and independent analyses should create their own with {@link #builder()}.
 * <p>
 * Not thread-safe: callers that share a registry between threads must serialize access to it.
 */
public final class UniqueObjectRegistry {
	/**
	 * The context used when none is specified.
	 */
	public static final String DEFAULT_CONTEXT = "default";

	private final String name;
	private final String instanceID = randomUUID().toString();
	private final RegistryConfig config;
	private final Map<String, Map<Class<?>, UniqueObjectIndex<?>>> indexesByContext = new LinkedHashMap<>();

	private UniqueObjectRegistry(String name, RegistryConfig config) {
		this.name = name;
		this.config = config;
	}

	public static UniqueObjectRegistry global() {
		return GlobalHolder.INSTANCE;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String name() {
		return name;
	}

	/**
	 * @return a string that distinguishes this registry from all others in this process, for logging
	 */
	public String instanceID() {
		return instanceID;
	}

	public RegistryConfig config() {
		return config;
	}

	// Indexes

	public <T extends UniqueObject> UniqueObjectIndex<T> index(Class<T> type) {
		return index(type, DEFAULT_CONTEXT);
	}

	/**
	 * @return the index for the given class and context, created if necessary
	 * @throws ConfigurationException if {@code context} is not a valid context name
	 */
	@SuppressWarnings("unchecked")
	public <T extends UniqueObject> UniqueObjectIndex<T> index(Class<T> type, String context) {
		requireNonNull(type);
		ContextNames.validate(context);
		return (UniqueObjectIndex<T>) indexesByContext
			.computeIfAbsent(context, c -> new LinkedHashMap<>())
			.computeIfAbsent(type, t -> {
				try (MDCScope ignored = setupMDC(context)) {
					LOGGER.debug("Creating index for {}", type.getSimpleName());
				}
				return new UniqueObjectIndex<>(this, type, context);
			});
	}

	/**
	 * Like {@link #index(Class, String)} but never creates anything.
	 */
	@SuppressWarnings("unchecked")
	public <T extends UniqueObject> Optional<UniqueObjectIndex<T>> existingIndex(Class<T> type, String context) {
		Map<Class<?>, UniqueObjectIndex<?>> indexes = indexesByContext.get(context);
		if (indexes == null) {
			return Optional.empty();
		}
		return Optional.ofNullable((UniqueObjectIndex<T>) indexes.get(type));
	}

	@SuppressWarnings("unchecked")
	<T extends UniqueObject> UniqueObjectIndex<T> indexOf(T obj, String context) {
		return index((Class<T>) obj.getClass(), context);
	}

	// Lookup

	public <T extends UniqueObject> T get(Class<T> type, String name) {
		return get(type, name, DEFAULT_CONTEXT);
	}

	public <T extends UniqueObject> T get(Class<T> type, int id) {
		return get(type, id, DEFAULT_CONTEXT);
	}

	/**
	 * @throws ObjectNotFoundException if the context has no such object
	 */
	public <T extends UniqueObject> T get(Class<T> type, String name, String context) {
		return requiredIndex(type, context).get(name);
	}

	public <T extends UniqueObject> T get(Class<T> type, int id, String context) {
		return requiredIndex(type, context).get(id);
	}

	public <T extends UniqueObject> boolean contains(Class<T> type, String name, String context) {
		return existingIndex(type, context).map(index -> index.contains(name)).orElse(false);
	}

	private <T extends UniqueObject> UniqueObjectIndex<T> requiredIndex(Class<T> type, String context) {
		return existingIndex(type, context).orElseThrow(() ->
			new ObjectNotFoundException("No " + type.getSimpleName() + " objects in context \"" + context + "\""));
	}

	// Contexts

	public Set<String> contexts() {
		return Set.copyOf(indexesByContext.keySet());
	}

	public boolean hasContext(String context) {
		return indexesByContext.containsKey(context);
	}

	/**
	 * @return the indexes of the given context in creation order; empty if the context is unknown
	 */
	public List<UniqueObjectIndex<?>> indexes(String context) {
		Map<Class<?>, UniqueObjectIndex<?>> indexes = indexesByContext.get(context);
		return indexes == null ? List.of() : List.copyOf(indexes.values());
	}

	/**
	 * Unregisters every object in the given context, keeping its (now empty) indexes.
	 *
	 * @throws ObjectNotFoundException if the context is unknown
	 */
	public void clearContext(String context) {
		Map<Class<?>, UniqueObjectIndex<?>> indexes = indexesByContext.get(context);
		if (indexes == null) {
			throw new ObjectNotFoundException("Unknown context \"" + context + "\"");
		}
		int count = 0;
		for (UniqueObjectIndex<?> index : indexes.values()) {
			count += index.size();
			index.clear();
		}
		if (count > 0) {
			try (MDCScope ignored = setupMDC(context)) {
				LOGGER.info("Cleared {} object{} from context \"{}\"", count, (count >= 2) ? "s" : "", context);
			}
		}
	}

	/**
	 * Unregisters every object in the given context and forgets the context.
	 *
	 * @throws ObjectNotFoundException if the context is unknown
	 */
	public void removeContext(String context) {
		clearContext(context);
		indexesByContext.remove(context);
	}

	/**
	 * Removes all contexts.
	 */
	public void clear() {
		for (String context : List.copyOf(indexesByContext.keySet())) {
			removeContext(context);
		}
	}

	// Registration

	/**
	 * @return the id that {@link UniqueObject#AUTO_ID} would resolve to for an object of
	 *   the given class registered in all the given contexts at once
	 */
	public int nextId(Class<? extends UniqueObject> type, Collection<String> contexts) {
		int result = 0;
		for (String context : contexts) {
			Optional<? extends UniqueObjectIndex<? extends UniqueObject>> index = existingIndex(type, context);
			if (index.isPresent()) {
				result = Math.max(result, index.get().nextId());
			}
		}
		return result;
	}

	/**
	 * Resolves the id and checks every target context, without modifying anything.
	 *
	 * @return the resolved id
	 * @throws DuplicateObjectException if the name or id is taken in any of the contexts
	 */
	int prepareRegistration(Class<? extends UniqueObject> type, String name, int requestedId, List<String> contexts) {
		int id = (requestedId == UniqueObject.AUTO_ID) ? nextId(type, contexts) : requestedId;
		for (String context : contexts) {
			existingIndex(type, context).ifPresent(index -> index.checkAvailable(name, id));
		}
		return id;
	}

	/**
	 * Caller must have called {@link #prepareRegistration} with no intervening changes.
	 */
	<T extends UniqueObject> List<IndexRegistration> commitRegistration(T obj, List<String> contexts) {
		List<IndexRegistration> result = new ArrayList<>(contexts.size());
		for (String context : contexts) {
			boolean newContext = !indexesByContext.containsKey(context);
			boolean newIndex = existingIndex(obj.getClass(), context).isEmpty();
			UniqueObjectIndex<T> index = indexOf(obj, context);
			result.add(new IndexRegistration(context, newContext, newIndex, index.highWaterMark()));
			index.insert(obj);
		}
		return result;
	}

	/**
	 * Undoes {@link #commitRegistration}: unregisters {@code obj}, gives back the ids it used up,
	 * and forgets indexes and contexts that were created for it and are still empty.
	 */
	<T extends UniqueObject> void rollbackRegistration(T obj, List<IndexRegistration> registrations) {
		for (IndexRegistration registration : registrations) {
			Map<Class<?>, UniqueObjectIndex<?>> indexes = indexesByContext.get(registration.context());
			if (indexes == null) {
				continue;
			}
			@SuppressWarnings("unchecked")
			UniqueObjectIndex<T> index = (UniqueObjectIndex<T>) indexes.get(obj.getClass());
			if (index == null) {
				continue;
			}
			index.removeIfPresent(obj);
			index.lowerHighWaterMark(obj.id(), registration.previousHighWaterMark());
			if (registration.createdIndex() && index.isEmpty()) {
				indexes.remove(obj.getClass());
			}
			if (registration.createdContext() && indexes.isEmpty()) {
				indexesByContext.remove(registration.context());
			}
		}
		LOGGER.debug("Rolled back registration of {} in {}", obj.uniqueKey(), registrations);
	}

	/**
	 * What registering an object changed in one context.
	 */
	record IndexRegistration(String context, boolean createdContext, boolean createdIndex, int previousHighWaterMark) { }

	MDCScope setupMDC(String context) {
		return MappedDiagnosticContext.setupMDC(name, instanceID, context);
	}

	@Override
	public String toString() {
		return "UniqueObjectRegistry(name=" + name + ", contexts=" + indexesByContext.keySet() + ")";
	}

	public static class Builder {
		private String name;
		private RegistryConfig config;

		Builder() {
			name = "registry";
			config = RegistryConfig.simple();
		}

		public Builder name(String name) {
			this.name = requireNonNull(name);
			return this;
		}

		public Builder config(RegistryConfig config) {
			this.config = requireNonNull(config);
			return this;
		}

		public UniqueObjectRegistry build() {
			return new UniqueObjectRegistry(name, config);
		}
	}

	private static final class GlobalHolder {
		static final UniqueObjectRegistry INSTANCE = builder().name("global").build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UniqueObjectRegistry.class);
}
