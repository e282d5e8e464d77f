package ca.gc.cra.nmapper.application.port;

import ca.gc.cra.nmapper.domain.error.ConflictException;
import ca.gc.cra.nmapper.domain.error.InfrastructureException;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Append-only persistence for snapshots and diffs.
 * <p><strong>Why:</strong> Keeps the orchestrator independent of the database; tests run against the in-memory
 * adapter and H2.</p>
 * <p><strong>Role:</strong> Implemented by {@code JdbcSnapshotStore} and {@code InMemorySnapshotStore}.</p>
 * <p><strong>Failure semantics:</strong> connectivity problems raise a retryable {@link InfrastructureException};
 * missing ids raise {@link NotFoundException}; malformed input raises {@link ValidationException}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by the orchestrator event
 * thread and the health loop.</p>
 *
 * @since 0.1.0
 */
public interface SnapshotStorePort extends AutoCloseable {
  /**
   * Opens connectivity and applies pending schema upgrades. Called once per orchestrator start; calling it again
   * after {@link #close()} reopens the store.
   *
   * @throws InfrastructureException if the store cannot be reached or migrated
   */
  void initialize();

  /**
   * Persists a snapshot.
   *
   * @param snapshot snapshot to store; its counts are re-validated
   * @return stored snapshot id
   * @throws ValidationException if the checksum no longer matches the devices
   * @throws ConflictException if the id already exists
   */
  String create(NetworkSnapshot snapshot);

  /**
   * Loads a snapshot.
   *
   * @param id snapshot id
   * @return stored snapshot
   * @throws NotFoundException if no snapshot has this id
   */
  NetworkSnapshot getById(String id);

  /**
   * Returns the snapshot with the newest timestamp.
   *
   * @return latest snapshot, or empty when none are stored
   */
  Optional<NetworkSnapshot> getLatest();

  /**
   * Lists snapshots matching a filter.
   *
   * @param query filter and ordering
   * @param page pagination
   * @return page of snapshots
   */
  Page<NetworkSnapshot> list(SnapshotQuery query, PageRequest page);

  /**
   * Persists a diff. Re-submitting a diff for an existing {@code (from, to)} pair is a no-op.
   *
   * @param diff diff to store
   * @return id of the stored (or previously stored) diff
   * @throws ValidationException if the diff compares a snapshot with itself
   * @throws NotFoundException if either referenced snapshot is missing
   */
  String createDiff(SnapshotDiff diff);

  /**
   * Loads the diff for an ordered snapshot pair.
   *
   * @param fromId older snapshot id
   * @param toId newer snapshot id
   * @return stored diff, if any
   */
  Optional<SnapshotDiff> getDiff(String fromId, String toId);

  /**
   * Lists diffs computed at or after {@code since}, oldest first.
   *
   * @param since inclusive lower bound on diff timestamp
   * @return ordered diffs
   */
  List<SnapshotDiff> listRecentDiffs(Instant since);

  /**
   * Deletes a snapshot and the diffs referencing it. Retention use only.
   *
   * @param id snapshot id
   * @throws NotFoundException if no snapshot has this id
   */
  void delete(String id);

  /**
   * Deletes snapshots (and their diffs) older than {@code cutoff}. Retention use only.
   *
   * @param cutoff exclusive upper bound on snapshot timestamp
   * @return number of snapshots deleted
   */
  int deleteOlderThan(Instant cutoff);

  /**
   * Aggregates stored snapshots per scan type.
   *
   * @return statistics ordered by scan type
   */
  List<ScanStatistics> statistics();

  /**
   * Verifies connectivity.
   *
   * @throws InfrastructureException if the store cannot be reached
   */
  void ping();

  /** Releases connections; {@link #initialize()} may reopen them. */
  @Override
  void close();
}
