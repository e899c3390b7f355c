package works.order.exceptions;

/**
 * A typed property was read before it was set, written while read-only,
 * or deleted while not deletable.
 */
public final class PropertyAccessException extends OrderException {
	private final Class<?> owner;
	private final String propertyName;

	public PropertyAccessException(Class<?> owner, String propertyName, String message) {
		super(owner.getSimpleName() + "." + propertyName + ": " + message);
		this.owner = owner;
		this.propertyName = propertyName;
	}

	public Class<?> owner() {
		return owner;
	}

	public String propertyName() {
		return propertyName;
	}
}
