/**
 * <strong>Purpose:</strong> Ports between the monitoring core and its collaborators (scanner, store, notifications,
 * metrics, clock).
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe; the scheduler workers, the orchestrator
 * event thread and the health loop call them concurrently.</p>
 * <p><strong>Observability:</strong> Ports do not prescribe logging; adapters log with SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.nmapper.application.port;
