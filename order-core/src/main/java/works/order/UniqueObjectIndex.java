package works.order;

import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.DuplicateObjectException;
import works.order.exceptions.InvalidTypeException;
import works.order.exceptions.InvalidValueException;
import works.order.exceptions.ObjectNotFoundException;
import works.order.logging.MappedDiagnosticContext.MDCScope;
import works.order.util.MatchMode;
import works.order.util.PatternSyntax;
import works.order.util.Patterns;

import static lombok.AccessLevel.PACKAGE;

/**
 * The objects of one exact class registered in one context of a {@link UniqueObjectRegistry}.
 * <p>
 * Every entry is reachable by name, by id, and by {@link UniqueKey}.
 * Iteration, {@link #getFirst()}, {@link #getLast()} and the snapshot methods
 * all use insertion order.
 * Snapshots are immutable and don't change when the index does.
 *
 * @param <T> the exact class of the indexed objects
 */
@RequiredArgsConstructor(access = PACKAGE)
public final class UniqueObjectIndex<T extends UniqueObject> implements Iterable<T> {
	private final UniqueObjectRegistry registry;
	private final Class<T> type;
	private final String context;
	private final Map<Integer, T> byId = new LinkedHashMap<>();
	private final Map<String, Integer> idsByName = new HashMap<>();
	private int highWaterMark = -1;

	public Class<T> type() {
		return type;
	}

	public String context() {
		return context;
	}

	public UniqueObjectRegistry registry() {
		return registry;
	}

	public int size() {
		return byId.size();
	}

	public boolean isEmpty() {
		return byId.isEmpty();
	}

	/**
	 * Registers an object in this index's context.
	 * The object must belong to the same registry; it may already be registered in other contexts.
	 *
	 * @throws DuplicateObjectException if the name or id is taken, in which case nothing changes
	 */
	public void add(T obj) {
		if (obj.getClass() != type) {
			throw new InvalidTypeException("Index of " + type.getSimpleName() + " can't hold " + obj.getClass().getSimpleName());
		} else if (obj.registry() != registry) {
			throw new ConfigurationException(obj + " belongs to a different registry than " + this);
		}
		checkAvailable(obj.name(), obj.id());
		insert(obj);
	}

	/**
	 * @throws DuplicateObjectException if either {@code name} or {@code id} is already in use
	 */
	void checkAvailable(String name, int id) {
		if (idsByName.containsKey(name)) {
			throw new DuplicateObjectException(type, context,
				type.getSimpleName() + " named \"" + name + "\" already exists in context \"" + context + "\"");
		} else if (byId.containsKey(id)) {
			throw new DuplicateObjectException(type, context,
				type.getSimpleName() + " with id " + id + " already exists in context \"" + context + "\"");
		}
	}

	/**
	 * Caller must have called {@link #checkAvailable} already.
	 */
	void insert(T obj) {
		assert !idsByName.containsKey(obj.name()) && !byId.containsKey(obj.id());
		byId.put(obj.id(), obj);
		idsByName.put(obj.name(), obj.id());
		highWaterMark = Math.max(highWaterMark, obj.id());
		obj.attached(context);
		try (MDCScope ignored = registry.setupMDC(context)) {
			LOGGER.debug("Registered {}", obj);
		}
	}

	/**
	 * @return the id that {@link UniqueObject#AUTO_ID} would resolve to in this index
	 */
	public int nextId() {
		try {
			return registry.config().idAllocation().nextId(highWaterMark, byId.keySet());
		} catch (ArithmeticException e) {
			throw new InvalidValueException("No automatic id left for " + type.getSimpleName() + " in context \"" + context + "\"", e);
		}
	}

	int highWaterMark() {
		return highWaterMark;
	}

	/**
	 * Takes back the high-water mark raised by {@code id}, unless something else has raised it since.
	 */
	void lowerHighWaterMark(int id, int previous) {
		if (highWaterMark == id) {
			int result = previous;
			for (int existing : byId.keySet()) {
				result = Math.max(result, existing);
			}
			highWaterMark = result;
		}
	}

	// Lookup

	/**
	 * @throws ObjectNotFoundException if there's no object with that name
	 */
	public T get(String name) {
		return find(name).orElseThrow(() -> notFound("named \"" + name + "\""));
	}

	/**
	 * @throws ObjectNotFoundException if there's no object with that id
	 */
	public T get(int id) {
		return find(id).orElseThrow(() -> notFound("with id " + id));
	}

	/**
	 * @throws ObjectNotFoundException unless {@code name} and {@code id} identify the same object
	 */
	public T get(String name, int id) {
		return find(name, id).orElseThrow(() -> notFound("with key " + new UniqueKey(name, id)));
	}

	public T get(UniqueKey key) {
		return get(key.name(), key.id());
	}

	public Optional<T> find(String name) {
		Integer id = idsByName.get(name);
		return id == null ? Optional.empty() : Optional.of(byId.get(id));
	}

	public Optional<T> find(int id) {
		return Optional.ofNullable(byId.get(id));
	}

	public Optional<T> find(String name, int id) {
		return find(name).filter(obj -> obj.id() == id);
	}

	/**
	 * @throws ObjectNotFoundException if this index is empty
	 */
	public T getFirst() {
		if (byId.isEmpty()) {
			throw notFound("at all");
		}
		return byId.values().iterator().next();
	}

	public T getFirst(T defaultValue) {
		return byId.isEmpty() ? defaultValue : getFirst();
	}

	/**
	 * @throws ObjectNotFoundException if this index is empty
	 */
	public T getLast() {
		if (byId.isEmpty()) {
			throw notFound("at all");
		}
		T last = null;
		for (T obj : byId.values()) {
			last = obj;
		}
		return last;
	}

	public T getLast(T defaultValue) {
		return byId.isEmpty() ? defaultValue : getLast();
	}

	public boolean contains(String name) {
		return idsByName.containsKey(name);
	}

	public boolean contains(int id) {
		return byId.containsKey(id);
	}

	/**
	 * @return true if this very object is in the index
	 */
	public boolean contains(UniqueObject obj) {
		return byId.get(obj.id()) == obj;
	}

	/**
	 * @return the objects whose name matches any of the shell-style {@code patterns}, in index order
	 */
	public List<T> query(Collection<String> patterns) {
		return query(patterns, MatchMode.ANY, PatternSyntax.GLOB);
	}

	public List<T> query(Collection<String> patterns, MatchMode mode, PatternSyntax syntax) {
		return byId.values().stream()
			.filter(obj -> Patterns.matches(obj.name(), patterns, mode, syntax))
			.toList();
	}

	// Removal

	/**
	 * @throws ObjectNotFoundException if there's no object with that name
	 */
	public T remove(String name) {
		T obj = get(name);
		removeEntry(obj);
		return obj;
	}

	/**
	 * @throws ObjectNotFoundException if there's no object with that id
	 */
	public T remove(int id) {
		T obj = get(id);
		removeEntry(obj);
		return obj;
	}

	/**
	 * @throws ObjectNotFoundException if this very object is not in the index
	 */
	public void remove(UniqueObject obj) {
		if (!contains(obj)) {
			throw notFound("matching " + obj);
		}
		removeEntry(byId.get(obj.id()));
	}

	public Optional<T> removeIfPresent(String name) {
		Optional<T> result = find(name);
		result.ifPresent(this::removeEntry);
		return result;
	}

	public Optional<T> removeIfPresent(int id) {
		Optional<T> result = find(id);
		result.ifPresent(this::removeEntry);
		return result;
	}

	public boolean removeIfPresent(UniqueObject obj) {
		if (contains(obj)) {
			removeEntry(byId.get(obj.id()));
			return true;
		}
		return false;
	}

	private void removeEntry(T obj) {
		byId.remove(obj.id());
		idsByName.remove(obj.name());
		obj.detached(context);
		try (MDCScope ignored = registry.setupMDC(context)) {
			LOGGER.debug("Unregistered {}", obj);
		}
	}

	/**
	 * Removes every object and resets automatic id allocation to 0.
	 */
	public void clear() {
		byId.values().forEach(obj -> obj.detached(context));
		byId.clear();
		idsByName.clear();
		highWaterMark = -1;
	}

	// Snapshots

	public PVector<String> names() {
		return TreePVector.from(byId.values().stream().map(UniqueObject::name).toList());
	}

	public PVector<Integer> ids() {
		return TreePVector.from(byId.keySet());
	}

	public PVector<T> values() {
		return TreePVector.from(byId.values());
	}

	public PVector<UniqueKey> keys() {
		return TreePVector.from(byId.values().stream().map(UniqueObject::uniqueKey).toList());
	}

	/**
	 * Iterates over a snapshot, so the index may be modified during iteration.
	 */
	@Override
	public Iterator<T> iterator() {
		return values().iterator();
	}

	public Stream<T> stream() {
		return values().stream();
	}

	private ObjectNotFoundException notFound(String description) {
		return new ObjectNotFoundException("No " + type.getSimpleName() + " " + description + " in context \"" + context + "\"");
	}

	@Override
	public String toString() {
		return "UniqueObjectIndex(" + type.getSimpleName() + ", context=" + context + ", size=" + byId.size() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UniqueObjectIndex.class);
}
