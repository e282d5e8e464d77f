package ca.gc.cra.nmapper.infrastructure.notify;

import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.NotificationPort;
import ca.gc.cra.nmapper.domain.snapshot.DiffSummary;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications as single WARN lines on the {@code nmapper.notifications} logger and counts them.
 *
 * @since 0.1.0
 */
public final class LoggingNotificationAdapter implements NotificationPort {
  private static final Logger log = LoggerFactory.getLogger("nmapper.notifications");

  private final MetricsPort metrics;

  /**
   * Creates the adapter.
   *
   * @param metrics metrics sink; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingNotificationAdapter(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void significantChange(NetworkSnapshot snapshot, SnapshotDiff diff, int threshold) {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(diff, "diff");
    metrics.increment("notify.log.significantChange");
    DiffSummary summary = diff.summary();
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("snapshot=" + snapshot.id());
    joiner.add("previous=" + diff.fromSnapshot());
    joiner.add("target=" + snapshot.metadata().scanTarget());
    joiner.add("total=" + summary.totalChanges());
    joiner.add("threshold=" + threshold);
    joiner.add("joined=" + summary.devicesAdded());
    joiner.add("left=" + summary.devicesRemoved());
    joiner.add("changed=" + summary.devicesChanged());
    joiner.add("ports=" + summary.portsChanged());
    joiner.add("services=" + summary.servicesChanged());
    log.warn("Significant network change [{}]", joiner);
  }

  @Override
  public void scanFailed(String jobId, String target, int attempts, String message) {
    metrics.increment("notify.log.scanFailed");
    log.warn("Scan failed [job={}, target={}, attempts={}]: {}", jobId, target, attempts, message);
  }
}
