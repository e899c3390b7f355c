package works.order.exceptions;

public final class ObjectNotFoundException extends OrderException {
	public ObjectNotFoundException(String message) {
		super(message);
	}
}
