/**
 * <strong>Purpose:</strong> Logging helpers that tune verbosity and keep scanner output and secrets out of logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; safe from scan workers and the CLI thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nmapper.logging;
