/**
 * Monitoring orchestration: lifecycle, the snapshot pipeline, health checks and the query surface used by the CLI.
 */
package ca.gc.cra.nmapper.application.monitoring;
