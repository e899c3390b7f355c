package works.order.exceptions;

/**
 * An invalid context name, selection dialect, attribute name,
 * or similar setting that is not data validation.
 */
public final class ConfigurationException extends OrderException {
	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
