package works.order;

/**
 * An object whose {@link TypedProperty typed properties} are stored in its own {@link PropertyStore}.
 * <p>
 * Implementations typically hold {@code private final PropertyStore properties = new PropertyStore();}
 * and return it here. Only {@link TypedProperty} can write to the store.
 */
public interface PropertyHolder {
	PropertyStore propertyStore();
}
