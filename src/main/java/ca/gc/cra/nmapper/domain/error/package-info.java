/**
 * Failure taxonomy shared by the scheduler, store, scanner adapters and orchestrator.
 * <p>Every failure carries an {@link ca.gc.cra.nmapper.domain.error.ErrorCategory} that decides whether it is
 * retried and how the CLI or an API layer reports it.</p>
 */
package ca.gc.cra.nmapper.domain.error;
