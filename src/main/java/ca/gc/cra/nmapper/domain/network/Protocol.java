package ca.gc.cra.nmapper.domain.network;

import java.util.Locale;

/**
 * Transport protocol of a scanned port.
 *
 * @since 0.1.0
 */
public enum Protocol {
  TCP,
  UDP;

  /**
   * Parses a protocol label case-insensitively.
   *
   * @param raw label such as {@code tcp}; {@code null} or blank resolves to {@link #TCP}
   * @return matching protocol
   * @throws IllegalArgumentException if the label is not a known protocol
   */
  public static Protocol from(String raw) {
    if (raw == null || raw.isBlank()) {
      return TCP;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "tcp" -> TCP;
      case "udp" -> UDP;
      default -> throw new IllegalArgumentException("protocol must be tcp or udp (was " + raw + ")");
    };
  }

  /**
   * Returns the lowercase wire label used in port keys and JSON payloads.
   *
   * @return {@code tcp} or {@code udp}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
