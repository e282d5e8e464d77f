package ca.gc.cra.nmapper.domain.snapshot;

import ca.gc.cra.nmapper.domain.network.Device;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * <strong>What:</strong> Immutable record of every device discovered at one point in time.
 * <p><strong>Why:</strong> Snapshots are the unit of persistence and comparison; once created they never change.</p>
 * <p><strong>Role:</strong> Produced by the orchestrator from a completed scan, persisted by {@code SnapshotStorePort}
 * and compared by {@code SnapshotDiffEngine}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; device list is copied on construction.</p>
 *
 * @param id unique snapshot id
 * @param timestamp creation time
 * @param deviceCount number of devices; must equal {@code devices.size()}
 * @param totalPorts total port entries across devices; must equal the sum of each device's port count
 * @param checksum content hash of {@code devices}; see {@link SnapshotChecksum}
 * @param devices devices with unique IPs
 * @param metadata scan provenance
 * @since 0.1.0
 */
public record NetworkSnapshot(
    String id,
    Instant timestamp,
    int deviceCount,
    int totalPorts,
    String checksum,
    List<Device> devices,
    SnapshotMetadata metadata) {

  /**
   * Enforces the counting and uniqueness invariants.
   *
   * @throws IllegalArgumentException if counts disagree with {@code devices} or two devices share an IP
   */
  public NetworkSnapshot {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("snapshot id must not be blank");
    }
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(checksum, "checksum");
    devices = devices == null ? List.of() : List.copyOf(devices);
    metadata = Objects.requireNonNullElseGet(metadata, SnapshotMetadata::empty);
    if (deviceCount != devices.size()) {
      throw new IllegalArgumentException(
          "deviceCount " + deviceCount + " does not match " + devices.size() + " devices");
    }
    int ports = countPorts(devices);
    if (totalPorts != ports) {
      throw new IllegalArgumentException("totalPorts " + totalPorts + " does not match " + ports + " ports");
    }
    Set<String> ips = new HashSet<>();
    for (Device device : devices) {
      if (!ips.add(device.ip())) {
        throw new IllegalArgumentException("duplicate device ip in snapshot: " + device.ip());
      }
    }
  }

  /**
   * Creates a snapshot with a fresh id, deriving counts and checksum from the device list.
   *
   * @param timestamp creation time
   * @param devices discovered devices
   * @param metadata scan provenance
   * @return new immutable snapshot
   */
  public static NetworkSnapshot create(Instant timestamp, List<Device> devices, SnapshotMetadata metadata) {
    return create(UUID.randomUUID().toString(), timestamp, devices, metadata);
  }

  /**
   * Creates a snapshot with the supplied id, deriving counts and checksum from the device list.
   *
   * @param id snapshot id
   * @param timestamp creation time
   * @param devices discovered devices
   * @param metadata scan provenance
   * @return new immutable snapshot
   */
  public static NetworkSnapshot create(
      String id, Instant timestamp, List<Device> devices, SnapshotMetadata metadata) {
    List<Device> copy = devices == null ? List.of() : List.copyOf(devices);
    return new NetworkSnapshot(
        id, timestamp, copy.size(), countPorts(copy), SnapshotChecksum.of(copy), copy, metadata);
  }

  /**
   * Looks up a device by IP.
   *
   * @param ip device IP
   * @return matching device, if present
   */
  public Optional<Device> device(String ip) {
    return devices.stream().filter(device -> device.ip().equals(ip)).findFirst();
  }

  /**
   * Recomputes the content hash and compares it with the stored checksum.
   *
   * @return {@code true} when the device content still matches {@link #checksum()}
   */
  public boolean checksumMatches() {
    return checksum.equals(SnapshotChecksum.of(devices));
  }

  private static int countPorts(List<Device> devices) {
    int total = 0;
    for (Device device : devices) {
      total += device.ports().size();
    }
    return total;
  }
}
