package ca.gc.cra.nmapper.testing;

import ca.gc.cra.nmapper.application.port.NotificationPort;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Notification sink that keeps every signal for later assertions. */
public final class RecordingNotifications implements NotificationPort {
  public record Significant(String snapshotId, SnapshotDiff diff, int threshold) {}

  public record Failure(String jobId, String target, int attempts, String message) {}

  private final List<Significant> significant = new CopyOnWriteArrayList<>();
  private final List<Failure> failures = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  @Override
  public void significantChange(NetworkSnapshot snapshot, SnapshotDiff diff, int threshold) {
    significant.add(new Significant(snapshot.id(), diff, threshold));
  }

  @Override
  public void scanFailed(String jobId, String target, int attempts, String message) {
    failures.add(new Failure(jobId, target, attempts, message));
  }

  @Override
  public void close() {
    closed = true;
  }

  public List<Significant> significant() {
    return List.copyOf(significant);
  }

  public List<Failure> failures() {
    return List.copyOf(failures);
  }

  public boolean closed() {
    return closed;
  }
}
