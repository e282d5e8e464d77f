/**
 * Orchestrator-owned health and metrics aggregates. Recomputed periodically and never persisted.
 */
package ca.gc.cra.nmapper.domain.monitoring;
