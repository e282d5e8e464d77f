package ca.gc.cra.nmapper.domain.snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Delta between two snapshots, listing only devices that changed.
 * <p><strong>Role:</strong> Output of {@code SnapshotDiffEngine}; persisted once per ordered {@code (from, to)} pair.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param fromSnapshot id of the older snapshot
 * @param toSnapshot id of the newer snapshot; equal to {@code fromSnapshot} only for a self-comparison, which
 *     the store refuses to persist
 * @param timestamp time the diff was computed
 * @param summary counters; must agree with {@code deviceChanges}
 * @param deviceChanges change entries sorted by device IP
 * @since 0.1.0
 */
public record SnapshotDiff(
    String fromSnapshot,
    String toSnapshot,
    Instant timestamp,
    DiffSummary summary,
    List<DeviceDiff> deviceChanges) {

  /**
   * Validates summary consistency.
   *
   * @throws IllegalArgumentException if the summary disagrees with the entries
   */
  public SnapshotDiff {
    Objects.requireNonNull(fromSnapshot, "fromSnapshot");
    Objects.requireNonNull(toSnapshot, "toSnapshot");
    Objects.requireNonNull(timestamp, "timestamp");
    deviceChanges = deviceChanges == null ? List.of() : List.copyOf(deviceChanges);
    DiffSummary derived = DiffSummary.of(deviceChanges);
    if (summary == null) {
      summary = derived;
    } else if (!summary.equals(derived)) {
      throw new IllegalArgumentException("diff summary " + summary + " disagrees with device changes " + derived);
    }
  }

  /**
   * Builds a diff whose summary is derived from {@code deviceChanges}.
   *
   * @param fromSnapshot older snapshot id
   * @param toSnapshot newer snapshot id
   * @param timestamp computation time
   * @param deviceChanges change entries
   * @return new diff
   */
  public static SnapshotDiff of(
      String fromSnapshot, String toSnapshot, Instant timestamp, List<DeviceDiff> deviceChanges) {
    return new SnapshotDiff(fromSnapshot, toSnapshot, timestamp, null, deviceChanges);
  }

  /**
   * Indicates whether both sides reference the same snapshot.
   *
   * @return {@code true} for a self-comparison
   */
  public boolean comparesSameSnapshot() {
    return fromSnapshot.equals(toSnapshot);
  }

  /**
   * Indicates whether the diff contains no changes.
   *
   * @return {@code true} when {@link DiffSummary#totalChanges()} is zero
   */
  public boolean hasNoChanges() {
    return deviceChanges.isEmpty();
  }
}
