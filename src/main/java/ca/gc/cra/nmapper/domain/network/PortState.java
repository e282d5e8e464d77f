package ca.gc.cra.nmapper.domain.network;

import java.util.Locale;

/**
 * Reported state of a scanned port.
 *
 * @since 0.1.0
 */
public enum PortState {
  OPEN,
  CLOSED,
  FILTERED;

  /**
   * Parses a scanner state label; compound nmap states such as {@code open|filtered} map to {@link #FILTERED}.
   *
   * @param raw state label; {@code null} resolves to {@link #OPEN}
   * @return parsed state
   * @throws IllegalArgumentException if the label is unknown
   */
  public static PortState from(String raw) {
    if (raw == null || raw.isBlank()) {
      return OPEN;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "open" -> OPEN;
      case "closed" -> CLOSED;
      case "filtered", "open|filtered", "closed|filtered", "unfiltered" -> FILTERED;
      default -> throw new IllegalArgumentException("unknown port state: " + raw);
    };
  }

  /**
   * Returns the lowercase label used in diff payloads.
   *
   * @return lowercase state label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
