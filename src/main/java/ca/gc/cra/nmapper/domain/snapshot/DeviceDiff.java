package ca.gc.cra.nmapper.domain.snapshot;

import ca.gc.cra.nmapper.domain.network.Device;
import java.util.List;
import java.util.Objects;

/**
 * Per-device entry of a {@link SnapshotDiff}. Unchanged devices never produce an entry.
 *
 * @param deviceIp IP of the device in the newer snapshot (or the older one for {@link ChangeType#DEVICE_LEFT})
 * @param changeType dominant change classification
 * @param deviceAdded full device for {@link ChangeType#DEVICE_JOINED}; otherwise {@code null}
 * @param deviceRemoved full device for {@link ChangeType#DEVICE_LEFT}; otherwise {@code null}
 * @param portChanges port-level changes in {@code (number, protocol)} order
 * @param serviceChanges service-level changes in {@code (port, protocol)} order
 * @param propertyChanges scalar property changes in a fixed property order
 * @since 0.1.0
 */
public record DeviceDiff(
    String deviceIp,
    ChangeType changeType,
    Device deviceAdded,
    Device deviceRemoved,
    List<PortDiff> portChanges,
    List<ServiceDiff> serviceChanges,
    List<PropertyChange> propertyChanges) {

  public DeviceDiff {
    Objects.requireNonNull(deviceIp, "deviceIp");
    Objects.requireNonNull(changeType, "changeType");
    portChanges = portChanges == null ? List.of() : List.copyOf(portChanges);
    serviceChanges = serviceChanges == null ? List.of() : List.copyOf(serviceChanges);
    propertyChanges = propertyChanges == null ? List.of() : List.copyOf(propertyChanges);
  }

  /**
   * Entry for a device present only in the newer snapshot.
   *
   * @param device joined device
   * @return joined entry
   */
  public static DeviceDiff joined(Device device) {
    return new DeviceDiff(device.ip(), ChangeType.DEVICE_JOINED, device, null, List.of(), List.of(), List.of());
  }

  /**
   * Entry for a device present only in the older snapshot.
   *
   * @param device departed device
   * @return left entry
   */
  public static DeviceDiff left(Device device) {
    return new DeviceDiff(device.ip(), ChangeType.DEVICE_LEFT, null, device, List.of(), List.of(), List.of());
  }

  /**
   * Indicates whether this entry counts toward {@link DiffSummary#devicesChanged()}.
   *
   * @return {@code true} unless the device joined or left
   */
  public boolean countsAsChanged() {
    return changeType != ChangeType.DEVICE_JOINED && changeType != ChangeType.DEVICE_LEFT;
  }
}
