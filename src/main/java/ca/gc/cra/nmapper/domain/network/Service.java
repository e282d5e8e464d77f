package ca.gc.cra.nmapper.domain.network;

import java.util.Objects;

/**
 * A service fingerprint detected on a port.
 *
 * @param port port the service listens on
 * @param protocol transport protocol; {@code null} defaults to {@link Protocol#TCP}
 * @param name service name (e.g. {@code ssh}); never blank
 * @param product optional product string (e.g. {@code OpenSSH})
 * @param version optional product version
 * @param confidence detection confidence in {@code 0..10}
 * @since 0.1.0
 */
public record Service(
    int port, Protocol protocol, String name, String product, String version, int confidence) {

  /**
   * Validates the record.
   *
   * @throws IllegalArgumentException if the port, name or confidence is invalid
   */
  public Service {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("service port must be between 1 and 65535 (was " + port + ")");
    }
    protocol = Objects.requireNonNullElse(protocol, Protocol.TCP);
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("service name must not be blank");
    }
    if (confidence < 0 || confidence > 10) {
      throw new IllegalArgumentException("service confidence must be between 0 and 10 (was " + confidence + ")");
    }
  }

  /**
   * Returns the identity key of this service within a device.
   *
   * @return {@code port/protocol} key
   */
  public String key() {
    return port + "/" + protocol.label();
  }
}
