package ca.gc.cra.nmapper.application.diff;

import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.network.IpOrder;
import ca.gc.cra.nmapper.domain.network.OsInfo;
import ca.gc.cra.nmapper.domain.network.Port;
import ca.gc.cra.nmapper.domain.network.PortState;
import ca.gc.cra.nmapper.domain.network.Service;
import ca.gc.cra.nmapper.domain.snapshot.ChangeType;
import ca.gc.cra.nmapper.domain.snapshot.DeviceDiff;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.PortDiff;
import ca.gc.cra.nmapper.domain.snapshot.PropertyChange;
import ca.gc.cra.nmapper.domain.snapshot.ServiceDiff;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Computes the {@link SnapshotDiff} between two snapshots.
 * <p><strong>Why:</strong> The orchestrator diffs every new snapshot against the previous latest to detect joined,
 * departed and changed devices.</p>
 * <p><strong>Role:</strong> Pure application service; no I/O, no clock, no shared mutable state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Match devices by IP (optionally falling back to MAC, see {@link DeviceIdentityPolicy}).</li>
 *   <li>Compare ports by {@code (number, protocol)}, services by {@code (port, protocol)} and scalar properties.</li>
 *   <li>Emit entries only for devices that changed, ordered by IP.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; a single instance may be shared across threads.</p>
 * <p><strong>Determinism:</strong> the diff timestamp is the newer snapshot's timestamp, so recomputing a diff
 * yields an equal value including ordering.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotDiffEngine {
  private static final Comparator<Port> PORT_ORDER =
      Comparator.comparingInt(Port::number).thenComparing(Port::protocol);
  private static final Comparator<Service> SERVICE_ORDER =
      Comparator.comparingInt(Service::port).thenComparing(Service::protocol);
  private static final Comparator<DeviceDiff> ENTRY_ORDER =
      Comparator.comparing(DeviceDiff::deviceIp, IpOrder.ASCENDING).thenComparing(DeviceDiff::changeType);

  private final DiffOptions options;

  /** Creates an engine with {@link DiffOptions#defaults()}. */
  public SnapshotDiffEngine() {
    this(DiffOptions.defaults());
  }

  /**
   * Creates an engine with explicit options.
   *
   * @param options comparison switches
   */
  public SnapshotDiffEngine(DiffOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Returns the options this engine compares with.
   *
   * @return comparison options
   */
  public DiffOptions options() {
    return options;
  }

  /**
   * Compares two snapshots.
   *
   * @param from older snapshot
   * @param to newer snapshot
   * @return diff listing only changed devices; empty when both snapshots hold the same inventory
   */
  public SnapshotDiff diff(NetworkSnapshot from, NetworkSnapshot to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    List<DeviceDiff> entries = compareDevices(from.devices(), to.devices());
    return SnapshotDiff.of(from.id(), to.id(), to.timestamp(), entries);
  }

  /**
   * Compares two device lists; exposed for callers that diff inventories without snapshots.
   *
   * @param fromDevices older devices
   * @param toDevices newer devices
   * @return change entries ordered by IP
   */
  public List<DeviceDiff> compareDevices(List<Device> fromDevices, List<Device> toDevices) {
    Map<String, Device> fromByIp = indexByIp(fromDevices);
    Map<String, Device> toByIp = indexByIp(toDevices);

    Map<String, Device> joined = new TreeMap<>(IpOrder.ASCENDING);
    Map<String, Device> left = new TreeMap<>(IpOrder.ASCENDING);
    List<DeviceDiff> entries = new ArrayList<>();

    for (Map.Entry<String, Device> entry : toByIp.entrySet()) {
      Device previous = fromByIp.get(entry.getKey());
      if (previous == null) {
        joined.put(entry.getKey(), entry.getValue());
      } else {
        DeviceDiff change = compareDevice(previous, entry.getValue(), false);
        if (change != null) {
          entries.add(change);
        }
      }
    }
    for (Map.Entry<String, Device> entry : fromByIp.entrySet()) {
      if (!toByIp.containsKey(entry.getKey())) {
        left.put(entry.getKey(), entry.getValue());
      }
    }

    if (options.identityPolicy() == DeviceIdentityPolicy.IP_THEN_MAC) {
      pairByMac(left, joined, entries);
    }

    joined.values().forEach(device -> entries.add(DeviceDiff.joined(device)));
    left.values().forEach(device -> entries.add(DeviceDiff.left(device)));
    entries.sort(ENTRY_ORDER);
    return List.copyOf(entries);
  }

  private void pairByMac(Map<String, Device> left, Map<String, Device> joined, List<DeviceDiff> entries) {
    Map<String, List<Device>> joinedByMac = groupByMac(joined.values());
    Map<String, List<Device>> leftByMac = groupByMac(left.values());
    Iterator<Map.Entry<String, Device>> it = left.entrySet().iterator();
    while (it.hasNext()) {
      Device departed = it.next().getValue();
      String mac = normalizeMac(departed.mac());
      if (mac == null) {
        continue;
      }
      List<Device> candidates = joinedByMac.get(mac);
      // Ambiguous MACs (several devices on either side) stay as joined/left.
      if (candidates == null || candidates.size() != 1 || leftByMac.get(mac).size() != 1) {
        continue;
      }
      Device arrived = candidates.get(0);
      joined.remove(arrived.ip());
      it.remove();
      DeviceDiff change = compareDevice(departed, arrived, true);
      if (change != null) {
        entries.add(change);
      }
    }
  }

  private DeviceDiff compareDevice(Device before, Device after, boolean ipMoved) {
    List<PortDiff> portChanges = comparePorts(before, after);
    List<ServiceDiff> serviceChanges =
        options.detectServiceChanges() ? compareServices(before, after) : List.of();
    List<PropertyChange> propertyChanges = compareProperties(before, after, ipMoved);
    if (portChanges.isEmpty() && serviceChanges.isEmpty() && propertyChanges.isEmpty()) {
      return null;
    }
    ChangeType type = classify(portChanges, serviceChanges, propertyChanges);
    return new DeviceDiff(after.ip(), type, null, null, portChanges, serviceChanges, propertyChanges);
  }

  private List<PortDiff> comparePorts(Device before, Device after) {
    Map<Port, Port> oldPorts = keyed(before.ports(), PORT_ORDER);
    Map<Port, Port> newPorts = keyed(after.ports(), PORT_ORDER);
    Set<Port> keys = new TreeSet<>(PORT_ORDER);
    keys.addAll(oldPorts.keySet());
    keys.addAll(newPorts.keySet());

    List<PortDiff> changes = new ArrayList<>();
    for (Port key : keys) {
      Port previous = oldPorts.get(key);
      Port current = newPorts.get(key);
      if (previous == null) {
        changes.add(new PortDiff(key.number(), key.protocol(), PortDiff.Kind.ADDED, null, current.state()));
      } else if (current == null) {
        changes.add(new PortDiff(key.number(), key.protocol(), PortDiff.Kind.REMOVED, previous.state(), null));
      } else if (previous.state() != current.state()) {
        changes.add(new PortDiff(
            key.number(), key.protocol(), PortDiff.Kind.STATE_CHANGED, previous.state(), current.state()));
      }
    }
    return changes;
  }

  private List<ServiceDiff> compareServices(Device before, Device after) {
    Map<Service, Service> oldServices = keyed(before.services(), SERVICE_ORDER);
    Map<Service, Service> newServices = keyed(after.services(), SERVICE_ORDER);
    Set<Service> keys = new TreeSet<>(SERVICE_ORDER);
    keys.addAll(oldServices.keySet());
    keys.addAll(newServices.keySet());

    List<ServiceDiff> changes = new ArrayList<>();
    for (Service key : keys) {
      Service previous = oldServices.get(key);
      Service current = newServices.get(key);
      if (previous == null) {
        changes.add(new ServiceDiff(key.port(), key.protocol(), ServiceDiff.Kind.ADDED, null, current));
      } else if (current == null) {
        changes.add(new ServiceDiff(key.port(), key.protocol(), ServiceDiff.Kind.REMOVED, previous, null));
      } else if (!Objects.equals(previous.name(), current.name())
          || !Objects.equals(previous.product(), current.product())
          || !Objects.equals(previous.version(), current.version())) {
        changes.add(new ServiceDiff(
            key.port(), key.protocol(), ServiceDiff.Kind.VERSION_CHANGED, previous, current));
      }
    }
    return changes;
  }

  private List<PropertyChange> compareProperties(Device before, Device after, boolean ipMoved) {
    List<PropertyChange> changes = new ArrayList<>();
    if (ipMoved) {
      changes.add(new PropertyChange("ip", before.ip(), after.ip()));
    }
    compare(changes, "hostname", before.hostname(), after.hostname());
    if (!Objects.equals(normalizeMac(before.mac()), normalizeMac(after.mac()))) {
      changes.add(new PropertyChange("mac", before.mac(), after.mac()));
    }
    compare(changes, "vendor", before.vendor(), after.vendor());
    compare(changes, "deviceType", before.deviceType(), after.deviceType());
    compare(changes, "riskLevel", label(before.riskLevel()), label(after.riskLevel()));
    compare(changes, "active", Boolean.toString(before.active()), Boolean.toString(after.active()));
    if (options.detectOsChanges()) {
      compareOs(changes, before.osInfo(), after.osInfo());
    }
    if (options.includeLastSeen()) {
      compare(changes, "lastSeen", text(before.lastSeen()), text(after.lastSeen()));
    }
    return changes;
  }

  private void compareOs(List<PropertyChange> changes, OsInfo before, OsInfo after) {
    if (before == null && after == null) {
      return;
    }
    OsInfo previous = before == null ? new OsInfo(null, null, null, null, null, 0) : before;
    OsInfo current = after == null ? new OsInfo(null, null, null, null, null, 0) : after;
    compare(changes, "osInfo.name", previous.name(), current.name());
    compare(changes, "osInfo.version", previous.version(), current.version());
    compare(changes, "osInfo.family", previous.family(), current.family());
    compare(changes, "osInfo.vendor", previous.vendor(), current.vendor());
    compare(changes, "osInfo.type", previous.type(), current.type());
    if (Math.abs(previous.accuracy() - current.accuracy()) >= options.osAccuracyThreshold()) {
      changes.add(new PropertyChange(
          "osInfo.accuracy", Integer.toString(previous.accuracy()), Integer.toString(current.accuracy())));
    }
  }

  private static ChangeType classify(
      List<PortDiff> ports, List<ServiceDiff> services, List<PropertyChange> properties) {
    if (properties.stream().anyMatch(change -> change.property().startsWith("osInfo."))) {
      return ChangeType.OS_CHANGED;
    }
    if (!services.isEmpty()) {
      return ChangeType.SERVICE_CHANGED;
    }
    if (ports.stream().anyMatch(p -> p.changeType() == PortDiff.Kind.ADDED
        || (p.changeType() == PortDiff.Kind.STATE_CHANGED && p.newState() == PortState.OPEN))) {
      return ChangeType.PORT_OPENED;
    }
    if (ports.stream().anyMatch(p -> p.changeType() == PortDiff.Kind.REMOVED
        || (p.changeType() == PortDiff.Kind.STATE_CHANGED && p.newState() == PortState.CLOSED))) {
      return ChangeType.PORT_CLOSED;
    }
    boolean wentInactive = properties.stream()
        .anyMatch(change -> change.property().equals("active") && "false".equals(change.newValue()));
    if (wentInactive) {
      return ChangeType.DEVICE_INACTIVE;
    }
    return ChangeType.DEVICE_CHANGED;
  }

  private static Map<String, Device> indexByIp(List<Device> devices) {
    Map<String, Device> index = new TreeMap<>(IpOrder.ASCENDING);
    for (Device device : devices) {
      index.putIfAbsent(device.ip(), device);
    }
    return index;
  }

  // First occurrence wins when a scanner reports the same key twice.
  private static <T> Map<T, T> keyed(List<T> values, Comparator<T> order) {
    Map<T, T> map = new TreeMap<>(order);
    for (T value : values) {
      map.putIfAbsent(value, value);
    }
    return map;
  }

  private static Map<String, List<Device>> groupByMac(Iterable<Device> devices) {
    Map<String, List<Device>> grouped = new HashMap<>();
    for (Device device : devices) {
      String mac = normalizeMac(device.mac());
      if (mac != null) {
        grouped.computeIfAbsent(mac, key -> new ArrayList<>()).add(device);
      }
    }
    return grouped;
  }

  private static void compare(List<PropertyChange> changes, String property, String before, String after) {
    if (!Objects.equals(before, after)) {
      changes.add(new PropertyChange(property, before, after));
    }
  }

  private static String normalizeMac(String mac) {
    if (mac == null || mac.isBlank()) {
      return null;
    }
    return mac.trim().replace('-', ':').toLowerCase(Locale.ROOT);
  }

  private static String label(Enum<?> value) {
    return value == null ? null : value.name().toLowerCase(Locale.ROOT);
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
