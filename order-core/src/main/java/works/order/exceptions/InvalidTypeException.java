package works.order.exceptions;

/**
 * The value has the wrong type, such as a number where a string is expected.
 */
public final class InvalidTypeException extends ValidationException {
	public InvalidTypeException(String message) {
		super(message);
	}

	public InvalidTypeException(String message, Throwable cause) {
		super(message, cause);
	}

	public static InvalidTypeException of(String what, Object value) {
		return new InvalidTypeException("invalid " + what + " type: " + describe(value));
	}

	@Override
	public InvalidTypeException inProperty(Class<?> owner, String propertyName) {
		return new InvalidTypeException(propertyMessage(owner, propertyName, getMessage()), this);
	}

	static String describe(Object value) {
		if (value == null) {
			return "null";
		}
		return value + " (" + value.getClass().getSimpleName() + ")";
	}
}
