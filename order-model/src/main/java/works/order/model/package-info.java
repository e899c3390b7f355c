/**
 * Analysis entities built on the order core.
 */
package works.order.model;
