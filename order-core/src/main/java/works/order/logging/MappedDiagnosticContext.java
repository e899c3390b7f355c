package works.order.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

import static works.order.logging.MdcKeys.CONTEXT;
import static works.order.logging.MdcKeys.REGISTRY_INSTANCE_ID;
import static works.order.logging.MdcKeys.REGISTRY_NAME;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	/**
	 * Sets the registry keys, and the context key when {@code context} is not null,
	 * until the returned scope is closed, at which point the previous values come back.
	 */
	public static MDCScope setupMDC(String registryName, String registryInstanceID, String context) {
		MDCScope scope = new MDCScope();
		scope.put(REGISTRY_NAME, registryName);
		scope.put(REGISTRY_INSTANCE_ID, registryInstanceID);
		if (context != null) {
			scope.put(CONTEXT, context);
		}
		return scope;
	}

	public static final class MDCScope implements AutoCloseable {
		private final Map<String, String> previous = new LinkedHashMap<>();

		private MDCScope() { }

		void put(String key, String value) {
			previous.putIfAbsent(key, MDC.get(key));
			MDC.put(key, value);
		}

		@Override
		public void close() {
			previous.forEach((key, value) -> {
				if (value == null) {
					MDC.remove(key);
				} else {
					MDC.put(key, value);
				}
			});
		}
	}
}
