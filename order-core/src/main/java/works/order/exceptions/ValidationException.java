package works.order.exceptions;

/**
 * A value offered to a typed property was rejected by its parser.
 * <p>
 * Parsers throw one of the two subclasses without knowing which property they serve;
 * {@link works.order.TypedProperty TypedProperty} then calls {@link #inProperty}
 * so the message names the owning class and property.
 */
public sealed abstract class ValidationException extends OrderException permits
	InvalidTypeException,
	InvalidValueException
{
	protected ValidationException(String message) {
		super(message);
	}

	protected ValidationException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same kind whose message is prefixed with the property location
	 */
	public abstract ValidationException inProperty(Class<?> owner, String propertyName);

	static String propertyMessage(Class<?> owner, String propertyName, String message) {
		return "Invalid property " + owner.getSimpleName() + "." + propertyName + ": " + message;
	}
}
