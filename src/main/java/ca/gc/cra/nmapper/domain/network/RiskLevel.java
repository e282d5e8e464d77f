package ca.gc.cra.nmapper.domain.network;

import java.util.Locale;

/**
 * Coarse risk classification attached to a device by the scanner adapter or operator.
 *
 * @since 0.1.0
 */
public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH;

  /**
   * Parses a risk label case-insensitively.
   *
   * @param raw label; {@code null} or blank yields {@code null} (unclassified)
   * @return parsed level or {@code null}
   * @throws IllegalArgumentException if the label is not recognised
   */
  public static RiskLevel fromNullable(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return RiskLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("riskLevel must be low, medium or high (was " + raw + ")", ex);
    }
  }
}
