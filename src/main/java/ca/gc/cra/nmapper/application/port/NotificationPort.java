package ca.gc.cra.nmapper.application.port;

import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;

/**
 * <strong>What:</strong> Fire-and-forget sink for "significant change" and "scan failed" signals.
 * <p><strong>Role:</strong> Implemented by {@code LoggingNotificationAdapter} and {@code KafkaNotificationAdapter}.</p>
 * <p><strong>Failure semantics:</strong> The orchestrator catches and counts runtime failures from this port;
 * they never fail the snapshot pipeline.</p>
 *
 * @since 0.1.0
 */
public interface NotificationPort extends AutoCloseable {
  /**
   * Publishes a diff whose total change count crossed the alerting threshold.
   *
   * @param snapshot newly stored snapshot
   * @param diff diff against the previous latest snapshot
   * @param threshold configured threshold that was exceeded
   */
  void significantChange(NetworkSnapshot snapshot, SnapshotDiff diff, int threshold);

  /**
   * Publishes a terminal scan failure after retries were exhausted.
   *
   * @param jobId scheduler job id
   * @param target scanned range
   * @param attempts attempts made
   * @param message failure detail
   */
  void scanFailed(String jobId, String target, int attempts, String message);

  /** Releases sink resources; the default does nothing. */
  @Override
  default void close() {}

  /** Notification sink that discards all signals. */
  NotificationPort NO_OP = new NotificationPort() {
    @Override public void significantChange(NetworkSnapshot snapshot, SnapshotDiff diff, int threshold) {}

    @Override public void scanFailed(String jobId, String target, int attempts, String message) {}
  };
}
