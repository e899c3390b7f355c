/**
 * Logback-specific logging utilities.
 */
module works.order.logback {
	requires transitive ch.qos.logback.classic;
	requires transitive ch.qos.logback.core;
	requires transitive org.slf4j;
	requires transitive works.order.core;

	exports works.order.logback;
}
