/**
 * Exceptions thrown by the order framework, all rooted at
 * {@link works.order.exceptions.OrderException OrderException}.
 */
package works.order.exceptions;
