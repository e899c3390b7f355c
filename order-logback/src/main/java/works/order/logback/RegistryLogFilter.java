package works.order.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.order.UniqueObjectRegistry;
import works.order.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.order.logging.MdcKeys.CONTEXT;
import static works.order.logging.MdcKeys.REGISTRY_INSTANCE_ID;

/**
 * Raises logger thresholds for the logs of one {@link UniqueObjectRegistry}, or of one
 * context within it, leaving every other registry's logs alone.
 * Handy for silencing expected warnings in tests.
 * <p>
 * Registries and indexes put {@link MdcKeys#REGISTRY_INSTANCE_ID} and {@link MdcKeys#CONTEXT}
 * in the MDC around everything they log; that's how a message is traced back to the
 * {@link LogController} {@link #attach attached} to its registry.
 * <p>
 * A logger with an explicitly configured level is never overridden.
 * Otherwise a threshold set for the message's context wins over one set for the whole registry,
 * and with neither the usual Logback rules apply.
 */
public class RegistryLogFilter extends TurboFilter {
	private static final Map<String, LogController> controllersByRegistryID = new ConcurrentHashMap<>();

	/**
	 * Logger thresholds for one registry. Uses Logback's {@link Level} so that {@link Level#OFF} is available.
	 */
	public static final class LogController {
		private final Map<String, Level> registryLevels = new ConcurrentHashMap<>();
		private final Map<String, Map<String, Level>> contextLevels = new ConcurrentHashMap<>();

		public void setLogging(Level level, Class<?>... loggers) {
			setLogging(level, names(loggers));
		}

		public void setLogging(Level level, String... loggers) {
			registryLevels.putAll(thresholds(level, loggers));
		}

		/**
		 * Like {@link #setLogging(Level, Class[])} but only for messages logged about {@code context}.
		 */
		public void setContextLogging(String context, Level level, Class<?>... loggers) {
			setContextLogging(context, level, names(loggers));
		}

		public void setContextLogging(String context, Level level, String... loggers) {
			contextLevels.computeIfAbsent(context, c -> new ConcurrentHashMap<>())
				.putAll(thresholds(level, loggers));
		}

		public void clearLogging() {
			registryLevels.clear();
			contextLevels.clear();
		}

		/**
		 * @return the threshold for {@code logger} in {@code context}, or null if there's none
		 */
		@Nullable Level threshold(String logger, @Nullable String context) {
			if (context != null) {
				Map<String, Level> levels = contextLevels.get(context);
				Level level = (levels == null) ? null : levels.get(logger);
				if (level != null) {
					return level;
				}
			}
			return registryLevels.get(logger);
		}

		private static String[] names(Class<?>[] loggers) {
			return Stream.of(loggers).map(Class::getName).toArray(String[]::new);
		}

		private static Map<String, Level> thresholds(Level level, String[] loggers) {
			return Stream.of(loggers).distinct().collect(toMap(name -> name, name -> level));
		}
	}

	/**
	 * Puts {@code registry}'s logs under {@code controller}.
	 * A registry has at most one controller at a time.
	 */
	public static void attach(UniqueObjectRegistry registry, LogController controller) {
		LogController previous = controllersByRegistryID.put(registry.instanceID(), controller);
		if (previous != null && previous != controller) {
			LOGGER.warn("Replaced the log controller of registry \"{}\" ({})", registry.name(), registry.instanceID());
		} else {
			LOGGER.debug("Attached a log controller to registry \"{}\" ({})", registry.name(), registry.instanceID());
		}
	}

	public static void detach(UniqueObjectRegistry registry) {
		controllersByRegistryID.remove(registry.instanceID());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			return NEUTRAL;
		}
		LogController controller = controllerFor(MDC.get(REGISTRY_INSTANCE_ID));
		if (controller == null) {
			return NEUTRAL;
		}
		Level threshold = controller.threshold(logger.getName(), MDC.get(CONTEXT));
		return (threshold == null || messageLevel.isGreaterOrEqual(threshold)) ? NEUTRAL : DENY;
	}

	private static @Nullable LogController controllerFor(@Nullable String registryID) {
		return (registryID == null) ? null : controllersByRegistryID.get(registryID);
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(RegistryLogFilter.class);
}
