/**
 * Reusable capabilities that entities compose.
 * <p>
 * Each capability is a small state-holding component ({@link works.order.mixins.AuxData},
 * {@link works.order.mixins.Tags}, {@link works.order.mixins.DataSource},
 * {@link works.order.mixins.Selection}, {@link works.order.mixins.Label})
 * paired with an interface whose default methods expose it on the owning entity.
 * Copying is provided by {@link works.order.mixins.Copyable} and {@link works.order.mixins.Copier}.
 */
package works.order.mixins;
