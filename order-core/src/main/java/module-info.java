/**
 * The order core: typed properties, uniquely identified objects and their registry.
 * <p>
 * Start with {@link works.order the root package}.
 * Additional packages provide the reusable entity capabilities ({@link works.order.mixins}),
 * common exceptions ({@link works.order.exceptions}), logging support ({@link works.order.logging}),
 * and the selection, pattern and copy helpers ({@link works.order.util}).
 */
module works.order.core {
	requires transitive org.jetbrains.annotations;
	requires transitive org.pcollections;
	requires org.slf4j;

	requires static lombok;

	exports works.order;
	exports works.order.exceptions;
	exports works.order.logging;
	exports works.order.mixins;
	exports works.order.util;
}
