package works.order.exceptions;

/**
 * Root of every exception thrown by the order framework.
 * <p>
 * All of these are unchecked: a failed validation, registration or lookup
 * is reported synchronously to the immediate caller and nothing is retried.
 */
public sealed abstract class OrderException extends RuntimeException permits
	ValidationException,
	DuplicateObjectException,
	ObjectNotFoundException,
	ConfigurationException,
	PropertyAccessException
{
	protected OrderException(String message) {
		super(message);
	}

	protected OrderException(String message, Throwable cause) {
		super(message, cause);
	}
}
