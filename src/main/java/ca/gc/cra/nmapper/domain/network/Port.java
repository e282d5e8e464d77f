package ca.gc.cra.nmapper.domain.network;

import java.util.Objects;

/**
 * <strong>What:</strong> A single scanned port on a device.
 * <p><strong>Why:</strong> Ports are compared by {@code (number, protocol)} when diffing snapshots.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param number port number in {@code 1..65535}
 * @param protocol transport protocol; {@code null} defaults to {@link Protocol#TCP}
 * @param state reported state; {@code null} defaults to {@link PortState#OPEN}
 * @param serviceName optional service name reported for the port
 * @param banner optional service banner
 * @since 0.1.0
 */
public record Port(int number, Protocol protocol, PortState state, String serviceName, String banner) {

  /**
   * Validates the port number and applies defaults.
   *
   * @throws IllegalArgumentException if {@code number} is outside {@code 1..65535}
   */
  public Port {
    if (number < 1 || number > 65535) {
      throw new IllegalArgumentException("port number must be between 1 and 65535 (was " + number + ")");
    }
    protocol = Objects.requireNonNullElse(protocol, Protocol.TCP);
    state = Objects.requireNonNullElse(state, PortState.OPEN);
  }

  /**
   * Convenience factory for an open port without service details.
   *
   * @param number port number
   * @param protocol transport protocol
   * @return open port
   */
  public static Port open(int number, Protocol protocol) {
    return new Port(number, protocol, PortState.OPEN, null, null);
  }

  /**
   * Returns the identity key of this port within a device, e.g. {@code 22/tcp}.
   *
   * @return {@code number/protocol} key
   */
  public String key() {
    return number + "/" + protocol.label();
  }
}
