/**
 * Snapshot comparison. {@link ca.gc.cra.nmapper.application.diff.SnapshotDiffEngine} is pure and deterministic.
 */
package ca.gc.cra.nmapper.application.diff;
