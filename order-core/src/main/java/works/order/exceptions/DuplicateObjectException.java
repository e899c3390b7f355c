package works.order.exceptions;

/**
 * An object could not be registered because its name or id is already
 * taken in one of its contexts.
 */
public final class DuplicateObjectException extends OrderException {
	private final Class<?> objectClass;
	private final String context;

	public DuplicateObjectException(Class<?> objectClass, String context, String message) {
		super(message);
		this.objectClass = objectClass;
		this.context = context;
	}

	public Class<?> objectClass() {
		return objectClass;
	}

	public String context() {
		return context;
	}
}
