package works.order.logging;

/**
 * MDC keys set while a {@link works.order.UniqueObjectRegistry registry} is working.
 */
public final class MdcKeys {
	private MdcKeys() { }

	public static final String REGISTRY_NAME = "order.registry.name";
	public static final String REGISTRY_INSTANCE_ID = "order.registry.instanceID";
	public static final String CONTEXT = "order.context";
}
