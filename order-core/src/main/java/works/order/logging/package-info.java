/**
 * Diagnostic-context support so that log lines can be attributed to one registry.
 */
package works.order.logging;
