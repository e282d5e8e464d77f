/**
 * Scan job scheduling: recurring and manual scan requests, bounded concurrency, retry with backoff and the typed
 * {@link ca.gc.cra.nmapper.application.scheduling.ScanEvent} channel consumed by the orchestrator.
 * <p><strong>Concurrency:</strong> one dispatch thread per scheduler; scans run on a bounded worker pool.</p>
 * <p><strong>Metrics:</strong> {@code scheduler.*}.</p>
 */
package ca.gc.cra.nmapper.application.scheduling;
