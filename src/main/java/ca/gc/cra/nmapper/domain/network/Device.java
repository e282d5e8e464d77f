package ca.gc.cra.nmapper.domain.network;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> A device discovered by a scan, identified by its IP address within a snapshot.
 * <p><strong>Why:</strong> Unit of comparison for the diff engine; port and service lists are keyed per device.</p>
 * <p><strong>Role:</strong> Domain value produced by scanner adapters and embedded in {@code NetworkSnapshot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied on construction.</p>
 *
 * @param ip identity key; never blank
 * @param mac optional hardware address
 * @param hostname optional resolved hostname
 * @param vendor optional NIC vendor
 * @param deviceType optional device classification
 * @param osInfo optional OS fingerprint
 * @param ports scanned ports, unique by {@code number/protocol}
 * @param services detected services
 * @param lastSeen time the device last answered; {@code null} when unknown
 * @param active whether the device answered during the scan
 * @param riskLevel optional risk classification
 * @since 0.1.0
 */
public record Device(
    String ip,
    String mac,
    String hostname,
    String vendor,
    String deviceType,
    OsInfo osInfo,
    List<Port> ports,
    List<Service> services,
    Instant lastSeen,
    boolean active,
    RiskLevel riskLevel) {

  /**
   * Validates identity and copies collections.
   *
   * @throws IllegalArgumentException if the IP is blank or two ports share a {@code number/protocol} key
   */
  public Device {
    Objects.requireNonNull(ip, "ip");
    ip = ip.trim();
    if (ip.isEmpty()) {
      throw new IllegalArgumentException("device ip must not be blank");
    }
    ports = ports == null ? List.of() : List.copyOf(ports);
    services = services == null ? List.of() : List.copyOf(services);
    Set<String> keys = new HashSet<>();
    for (Port port : ports) {
      if (!keys.add(port.key())) {
        throw new IllegalArgumentException("duplicate port " + port.key() + " on device " + ip);
      }
    }
  }

  /**
   * Starts a builder for a device with the given IP address.
   *
   * @param ip device IP
   * @return new builder marked active
   */
  public static Builder builder(String ip) {
    return new Builder(ip);
  }

  /**
   * Returns a builder pre-populated with this device's values.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder builder = new Builder(ip);
    builder.mac = mac;
    builder.hostname = hostname;
    builder.vendor = vendor;
    builder.deviceType = deviceType;
    builder.osInfo = osInfo;
    builder.ports.addAll(ports);
    builder.services.addAll(services);
    builder.lastSeen = lastSeen;
    builder.active = active;
    builder.riskLevel = riskLevel;
    return builder;
  }

  /** Mutable builder used by scanner adapters and tests. */
  public static final class Builder {
    private final String ip;
    private String mac;
    private String hostname;
    private String vendor;
    private String deviceType;
    private OsInfo osInfo;
    private final List<Port> ports = new ArrayList<>();
    private final List<Service> services = new ArrayList<>();
    private Instant lastSeen;
    private boolean active = true;
    private RiskLevel riskLevel;

    private Builder(String ip) {
      this.ip = ip;
    }

    public Builder mac(String value) {
      this.mac = value;
      return this;
    }

    public Builder hostname(String value) {
      this.hostname = value;
      return this;
    }

    public Builder vendor(String value) {
      this.vendor = value;
      return this;
    }

    public Builder deviceType(String value) {
      this.deviceType = value;
      return this;
    }

    public Builder osInfo(OsInfo value) {
      this.osInfo = value;
      return this;
    }

    public Builder port(Port port) {
      this.ports.add(Objects.requireNonNull(port, "port"));
      return this;
    }

    public Builder ports(List<Port> values) {
      this.ports.clear();
      if (values != null) {
        this.ports.addAll(values);
      }
      return this;
    }

    public Builder service(Service service) {
      this.services.add(Objects.requireNonNull(service, "service"));
      return this;
    }

    public Builder services(List<Service> values) {
      this.services.clear();
      if (values != null) {
        this.services.addAll(values);
      }
      return this;
    }

    public Builder lastSeen(Instant value) {
      this.lastSeen = value;
      return this;
    }

    public Builder active(boolean value) {
      this.active = value;
      return this;
    }

    public Builder riskLevel(RiskLevel value) {
      this.riskLevel = value;
      return this;
    }

    public Device build() {
      return new Device(
          ip, mac, hostname, vendor, deviceType, osInfo, ports, services, lastSeen, active, riskLevel);
    }
  }
}
