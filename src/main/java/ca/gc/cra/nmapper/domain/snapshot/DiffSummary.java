package ca.gc.cra.nmapper.domain.snapshot;

import java.util.List;

/**
 * Aggregate counters of a {@link SnapshotDiff}.
 *
 * <p>{@link #totalChanges()} is always the sum of the five counters; it is not a stored component.</p>
 *
 * @param devicesAdded devices present only in the newer snapshot
 * @param devicesRemoved devices present only in the older snapshot
 * @param devicesChanged devices present in both with at least one sub-change
 * @param portsChanged port changes across all devices
 * @param servicesChanged service changes across all devices
 * @since 0.1.0
 */
public record DiffSummary(
    int devicesAdded, int devicesRemoved, int devicesChanged, int portsChanged, int servicesChanged) {

  /** Summary of a diff without changes. */
  public static final DiffSummary EMPTY = new DiffSummary(0, 0, 0, 0, 0);

  public DiffSummary {
    if (devicesAdded < 0 || devicesRemoved < 0 || devicesChanged < 0 || portsChanged < 0 || servicesChanged < 0) {
      throw new IllegalArgumentException("diff counters must not be negative");
    }
  }

  /**
   * Derives the counters from a list of device entries.
   *
   * @param changes device entries
   * @return summary consistent with {@code changes}
   */
  public static DiffSummary of(List<DeviceDiff> changes) {
    int added = 0;
    int removed = 0;
    int changed = 0;
    int ports = 0;
    int services = 0;
    for (DeviceDiff change : changes) {
      switch (change.changeType()) {
        case DEVICE_JOINED -> added++;
        case DEVICE_LEFT -> removed++;
        default -> changed++;
      }
      ports += change.portChanges().size();
      services += change.serviceChanges().size();
    }
    return new DiffSummary(added, removed, changed, ports, services);
  }

  /**
   * Sum of all counters.
   *
   * @return total change count
   */
  public int totalChanges() {
    return devicesAdded + devicesRemoved + devicesChanged + portsChanged + servicesChanged;
  }
}
