package works.order.exceptions;

/**
 * The value has an acceptable type but is out of range or has the wrong shape,
 * such as an empty name or a binning with two entries.
 */
public final class InvalidValueException extends ValidationException {
	public InvalidValueException(String message) {
		super(message);
	}

	public InvalidValueException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public InvalidValueException inProperty(Class<?> owner, String propertyName) {
		return new InvalidValueException(propertyMessage(owner, propertyName, getMessage()), this);
	}
}
