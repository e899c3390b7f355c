/**
 * Analysis entities built on {@link works.order the order core}.
 */
module works.order.model {
	requires transitive works.order.core;
	requires org.slf4j;

	exports works.order.model;
}
