package ca.gc.cra.nmapper.domain.snapshot;

import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.network.IpOrder;
import ca.gc.cra.nmapper.domain.network.OsInfo;
import ca.gc.cra.nmapper.domain.network.Port;
import ca.gc.cra.nmapper.domain.network.Service;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Content hash over a device list.
 *
 * <p>Devices are rendered in IP order with ports and services in key order, so two snapshots holding the
 * same inventory hash identically regardless of scanner output order. {@code lastSeen} is excluded.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotChecksum {
  private static final char FIELD = '\u001f';
  private static final char RECORD = '\u001e';

  private SnapshotChecksum() {}

  /**
   * Computes the SHA-256 hex digest of the canonical device rendering.
   *
   * @param devices devices to hash; never {@code null}
   * @return lowercase hex digest
   */
  public static String of(List<Device> devices) {
    StringBuilder canonical = new StringBuilder(devices.size() * 64);
    devices.stream()
        .sorted(Comparator.comparing(Device::ip, IpOrder.ASCENDING))
        .forEach(device -> appendDevice(canonical, device));
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  private static void appendDevice(StringBuilder out, Device device) {
    field(out, device.ip());
    field(out, device.mac());
    field(out, device.hostname());
    field(out, device.vendor());
    field(out, device.deviceType());
    OsInfo os = device.osInfo();
    if (os != null) {
      field(out, os.name());
      field(out, os.version());
      field(out, os.family());
      field(out, os.vendor());
      field(out, os.type());
      field(out, Integer.toString(os.accuracy()));
    }
    field(out, Boolean.toString(device.active()));
    field(out, device.riskLevel() == null ? null : device.riskLevel().name());
    device.ports().stream()
        .sorted(Comparator.comparingInt(Port::number).thenComparing(Port::protocol))
        .forEach(port -> {
          field(out, port.key());
          field(out, port.state().label());
          field(out, port.serviceName());
          field(out, port.banner());
        });
    device.services().stream()
        .sorted(Comparator.comparingInt(Service::port).thenComparing(Service::protocol))
        .forEach(service -> {
          field(out, service.key());
          field(out, service.name());
          field(out, service.product());
          field(out, service.version());
          field(out, Integer.toString(service.confidence()));
        });
    out.append(RECORD);
  }

  private static void field(StringBuilder out, String value) {
    out.append(value == null ? "" : value).append(FIELD);
  }
}
