/**
 * Application layer: ports, the diff engine, the scan scheduler, resilience utilities and the orchestrator.
 * <p><strong>Role:</strong> Coordinates domain values and delegates I/O to adapters through ports.</p>
 */
package ca.gc.cra.nmapper.application;
