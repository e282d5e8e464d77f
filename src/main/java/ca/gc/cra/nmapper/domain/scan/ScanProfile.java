package ca.gc.cra.nmapper.domain.scan;

import ca.gc.cra.nmapper.domain.error.ValidationException;
import java.util.Locale;

/**
 * Named preset controlling scan depth and speed.
 *
 * @since 0.1.0
 */
public enum ScanProfile {
  /** Fast scan of the most common ports. */
  QUICK,
  /** Host discovery with light port probing. */
  DISCOVERY,
  /** Full port and service/OS fingerprinting. */
  COMPREHENSIVE;

  /**
   * Parses a profile label case-insensitively.
   *
   * @param raw label; {@code null} or blank resolves to {@link #DISCOVERY}
   * @return parsed profile
   * @throws ValidationException if the label is unknown
   */
  public static ScanProfile from(String raw) {
    if (raw == null || raw.isBlank()) {
      return DISCOVERY;
    }
    try {
      return ScanProfile.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("scan profile must be quick, discovery or comprehensive (was " + raw + ")", ex);
    }
  }

  /**
   * Lowercase label passed to scanner commands.
   *
   * @return profile label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
