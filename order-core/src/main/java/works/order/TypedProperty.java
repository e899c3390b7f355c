package works.order;

import works.order.exceptions.PropertyAccessException;
import works.order.exceptions.ValidationException;

import static java.util.Objects.requireNonNull;

/**
 * A validated property of a {@link PropertyHolder}, declared once per owning class:
 *
 * <pre>{@code
 * static final TypedProperty<Variable, String> X_TITLE = TypedProperty.of("xTitle", Parsers.string("xTitle"));
 *
 * public String xTitle() { return X_TITLE.get(this); }
 * public void setXTitle(String xTitle) { X_TITLE.set(this, xTitle); }
 * }</pre>
 *
 * Every write goes through the {@link Parser}. If the parser throws, the backing slot is
 * left untouched and the {@link ValidationException} propagates, relabelled with the owner
 * class and property name.
 *
 * @param <O> the owning type
 * @param <T> the stored value type
 */
public final class TypedProperty<O extends PropertyHolder, T> {
	private final String name;
	private final String backingName;
	private final Parser<? super O, ? extends T> parser;
	private final boolean settable;
	private final boolean deletable;

	private TypedProperty(String name, String backingName, Parser<? super O, ? extends T> parser, boolean settable, boolean deletable) {
		this.name = name;
		this.backingName = backingName;
		this.parser = parser;
		this.settable = settable;
		this.deletable = deletable;
	}

	/**
	 * @return a settable, deletable property whose backing slot is {@code "_" + name}
	 */
	public static <O extends PropertyHolder, T> TypedProperty<O, T> of(String name, Parser<? super O, ? extends T> parser) {
		if (requireNonNull(name).isEmpty()) {
			throw new IllegalArgumentException("Property name can't be empty");
		}
		return new TypedProperty<>(name, "_" + name, requireNonNull(parser), true, true);
	}

	public TypedProperty<O, T> readOnly() {
		return new TypedProperty<>(name, backingName, parser, false, deletable);
	}

	public TypedProperty<O, T> notDeletable() {
		return new TypedProperty<>(name, backingName, parser, settable, false);
	}

	public TypedProperty<O, T> backedBy(String backingName) {
		if (requireNonNull(backingName).isEmpty()) {
			throw new IllegalArgumentException("Backing name can't be empty");
		}
		return new TypedProperty<>(name, backingName, parser, settable, deletable);
	}

	public String name() {
		return name;
	}

	public String backingName() {
		return backingName;
	}

	public boolean isSettable() {
		return settable;
	}

	public boolean isDeletable() {
		return deletable;
	}

	/**
	 * @throws PropertyAccessException if the slot was never initialized or has been deleted
	 */
	@SuppressWarnings("unchecked")
	public T get(O owner) {
		PropertyStore store = owner.propertyStore();
		if (!store.contains(backingName)) {
			throw new PropertyAccessException(owner.getClass(), name, "property has no value");
		}
		return (T) store.get(backingName);
	}

	public boolean isSet(O owner) {
		return owner.propertyStore().contains(backingName);
	}

	/**
	 * @return the stored value
	 * @throws PropertyAccessException if this property is {@link #readOnly() read-only}
	 * @throws ValidationException if the parser rejects {@code raw}
	 */
	public T set(O owner, Object raw) {
		if (!settable) {
			throw new PropertyAccessException(owner.getClass(), name, "property is read-only");
		}
		return initialize(owner, raw);
	}

	/**
	 * Like {@link #set} but permitted on read-only properties.
	 * Intended for the owner's constructor.
	 */
	public T initialize(O owner, Object raw) {
		T value = parse(owner, raw);
		owner.propertyStore().put(backingName, value);
		return value;
	}

	/**
	 * Runs the parser without storing anything.
	 *
	 * @throws ValidationException if the parser rejects {@code raw}
	 */
	public T parse(O owner, Object raw) {
		try {
			return parser.parse(owner, raw);
		} catch (ValidationException e) {
			throw e.inProperty(owner.getClass(), name);
		}
	}

	/**
	 * @throws PropertyAccessException if this property is {@link #notDeletable() not deletable}
	 *   or currently has no value
	 */
	public void delete(O owner) {
		if (!deletable) {
			throw new PropertyAccessException(owner.getClass(), name, "property can't be deleted");
		}
		PropertyStore store = owner.propertyStore();
		if (!store.contains(backingName)) {
			throw new PropertyAccessException(owner.getClass(), name, "property has no value");
		}
		store.remove(backingName);
	}

	@Override
	public String toString() {
		return "TypedProperty(" + name
			+ (settable ? "" : ", read-only")
			+ (deletable ? "" : ", not deletable")
			+ ")";
	}
}
