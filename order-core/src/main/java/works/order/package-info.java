/**
 * The core of the order framework: {@link works.order.TypedProperty validated properties}
 * and {@link works.order.UniqueObject uniquely identified objects}
 * tracked by a {@link works.order.UniqueObjectRegistry registry} of per-context
 * {@link works.order.UniqueObjectIndex indexes}.
 */
package works.order;
