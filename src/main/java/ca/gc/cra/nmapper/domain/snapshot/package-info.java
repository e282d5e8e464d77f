/**
 * Immutable point-in-time snapshots and the diffs computed between them.
 * <p><strong>Role:</strong> Domain values persisted by {@code SnapshotStorePort} and produced by the diff engine.</p>
 * <p><strong>Concurrency:</strong> Immutable; safe to hand across the scheduler, orchestrator and store threads.</p>
 * <p><strong>Invariants:</strong> {@code deviceCount == devices.size()}, device IPs are unique per snapshot and
 * {@code DiffSummary.totalChanges()} is always derived from the five counters.</p>
 */
package ca.gc.cra.nmapper.domain.snapshot;
