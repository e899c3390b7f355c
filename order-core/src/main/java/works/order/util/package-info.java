/**
 * Pure helpers used by the core: pattern matching, selection joining,
 * ROOT-latex conversion, and deep copying.
 */
package works.order.util;
