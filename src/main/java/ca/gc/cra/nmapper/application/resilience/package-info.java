/**
 * Retry with exponential backoff and a stateful circuit breaker.
 * <p>One {@link ca.gc.cra.nmapper.application.resilience.CircuitBreaker} instance guards one class of operation
 * (for example all snapshot store calls) and is reused for the lifetime of its owner.</p>
 */
package ca.gc.cra.nmapper.application.resilience;
