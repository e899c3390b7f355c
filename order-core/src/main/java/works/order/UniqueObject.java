package works.order;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.order.exceptions.ConfigurationException;
import works.order.exceptions.DuplicateObjectException;
import works.order.exceptions.InvalidTypeException;
import works.order.exceptions.InvalidValueException;
import works.order.exceptions.ObjectNotFoundException;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * An object identified by a name and an integer id, registered in one or more
 * contexts of a {@link UniqueObjectRegistry}.
 * <p>
 * Within one context, no two objects of the same class share a name or an id.
 * The same class may reuse names and ids across contexts.
 * Objects are registered by this constructor, before the subclass constructor body runs;
 * a subclass whose own initialization fails should call {@link #abandonRegistration()} before rethrowing,
 * so that a half-built object is never left behind in an index.
 *
 * <p>
 * <b>Note</b>: two objects are {@link #equals equal} if they have the same class,
 * live in the same registry, have the same id, and share at least one context.
 * This is not transitive when objects live in several contexts,
 * so think twice before putting objects from different contexts in the same {@code Set}.
 */
public abstract class UniqueObject {
	/**
	 * Passed as the id to request the next free id.
	 */
	public static final int AUTO_ID = -1;

	/**
	 * Same as {@link #AUTO_ID}, for attribute maps.
	 */
	public static final String AUTO_ID_MARKER = "+";

	private final UniqueObjectRegistry registry;
	private final String name;
	private final int id;
	private final List<String> contexts = new ArrayList<>(1);
	private List<UniqueObjectRegistry.IndexRegistration> registration;

	/**
	 * @param name a non-empty string
	 * @param id an integer {@code >= 0}, or {@link #AUTO_ID}, or {@link #AUTO_ID_MARKER}
	 * @param context null for the {@link UniqueObjectRegistry#DEFAULT_CONTEXT default context},
	 *                a context name, or a collection of context names
	 * @throws InvalidTypeException if {@code name} or {@code id} has the wrong type
	 * @throws InvalidValueException if {@code name} is empty or {@code id} is negative
	 * @throws ConfigurationException if a context name is invalid
	 * @throws DuplicateObjectException if the name or id is taken in any of the contexts,
	 *   in which case no context is modified
	 */
	@SuppressWarnings("this-escape")
	protected UniqueObject(UniqueObjectRegistry registry, Object name, @Nullable Object id, @Nullable Object context) {
		this.registry = requireNonNull(registry);
		this.name = parseName(name);
		List<String> targetContexts = ContextNames.parse(context);
		this.id = registry.prepareRegistration(getClass(), this.name, parseId(id), targetContexts);
		this.registration = registry.commitRegistration(this, targetContexts);
	}

	protected UniqueObject(UniqueObjectRegistry registry, String name) {
		this(registry, name, AUTO_ID, null);
	}

	static String parseName(Object raw) {
		if (!(raw instanceof String s)) {
			throw InvalidTypeException.of("name", raw);
		} else if (s.isEmpty()) {
			throw new InvalidValueException("name must not be empty");
		}
		return s;
	}

	static int parseId(Object raw) {
		if (raw == null || AUTO_ID_MARKER.equals(raw)) {
			return AUTO_ID;
		} else if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
			long value = ((Number) raw).longValue();
			if (value == AUTO_ID) {
				return AUTO_ID;
			} else if (value < 0) {
				throw new InvalidValueException("id must not be negative: " + value);
			} else if (value > Integer.MAX_VALUE) {
				throw new InvalidValueException("id is too large: " + value);
			}
			return (int) value;
		}
		throw InvalidTypeException.of("id", raw);
	}

	public final String name() {
		return name;
	}

	public final int id() {
		return id;
	}

	public final UniqueKey uniqueKey() {
		return new UniqueKey(name, id);
	}

	public final UniqueObjectRegistry registry() {
		return registry;
	}

	/**
	 * @return the contexts this object is currently registered in, in registration order
	 */
	public final List<String> contexts() {
		return List.copyOf(contexts);
	}

	public final boolean isRegistered() {
		return !contexts.isEmpty();
	}

	public final boolean isRegisteredIn(String context) {
		return contexts.contains(context);
	}

	/**
	 * Unregisters this object from every context it is registered in.
	 * The object itself remains usable.
	 */
	public final void remove() {
		for (String context : List.copyOf(contexts)) {
			registry.indexOf(this, context).remove(this);
		}
	}

	/**
	 * Undoes the registration done by the constructor, as if it had never happened:
	 * the object leaves every context, the automatic ids it used up become available again,
	 * and contexts or indexes created just for it are forgotten.
	 * Meant for subclass constructors that fail after {@code super(...)} returns.
	 * Only the first call has any effect.
	 */
	protected final void abandonRegistration() {
		if (registration != null) {
			registry.rollbackRegistration(this, registration);
			registration = null;
		}
	}

	/**
	 * Unregisters this object from the given contexts only.
	 *
	 * @throws ObjectNotFoundException if this object is not registered in one of them,
	 *   in which case nothing is removed
	 */
	public final void remove(String... contexts) {
		remove(asList(contexts));
	}

	public final void remove(Collection<String> contexts) {
		Set<String> targets = new LinkedHashSet<>(contexts);
		for (String context : targets) {
			if (!this.contexts.contains(context)) {
				throw new ObjectNotFoundException(this + " is not registered in context \"" + context + "\"");
			}
		}
		for (String context : targets) {
			registry.indexOf(this, context).remove(this);
		}
	}

	void attached(String context) {
		if (!contexts.contains(context)) {
			contexts.add(context);
		}
	}

	void detached(String context) {
		contexts.remove(context);
	}

	@Override
	public final boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		UniqueObject that = (UniqueObject) o;
		return id == that.id
			&& registry == that.registry
			&& !Collections.disjoint(contexts, that.contexts);
	}

	@Override
	public final int hashCode() {
		return Objects.hash(getClass(), id);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(name=" + name + ", id=" + id + ", contexts=" + contexts + ")";
	}
}
