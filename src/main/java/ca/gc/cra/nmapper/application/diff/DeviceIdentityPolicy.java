package ca.gc.cra.nmapper.application.diff;

import java.util.Locale;

/**
 * How devices in two snapshots are matched to each other.
 *
 * @since 0.1.0
 */
public enum DeviceIdentityPolicy {
  /**
   * Devices are the same when their IPs are equal. A MAC change at a stable IP is a property change; a device
   * that moved to a new IP shows up as one device leaving and one joining.
   */
  IP,
  /**
   * Devices are first matched by IP. A leftover departed device and a leftover joined device that share one
   * non-blank MAC address are then reported as a single changed device with an {@code ip} property change.
   */
  IP_THEN_MAC;

  /**
   * Parses a policy label such as {@code ip} or {@code ip_then_mac}.
   *
   * @param raw label; blank resolves to {@link #IP}
   * @return parsed policy
   * @throws IllegalArgumentException if the label is unknown
   */
  public static DeviceIdentityPolicy from(String raw) {
    if (raw == null || raw.isBlank()) {
      return IP;
    }
    String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return DeviceIdentityPolicy.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("identityPolicy must be ip or ip_then_mac (was " + raw + ")", ex);
    }
  }
}
