package ca.gc.cra.nmapper.domain.scan;

import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.validation.Net;
import java.util.Objects;

/**
 * A validated scan target: a single IP, a CIDR block or a dash range.
 *
 * @param value normalized target text
 * @param kind target shape
 * @since 0.1.0
 */
public record ScanTarget(String value, Kind kind) {

  public ScanTarget {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Validates and normalizes a target expression such as {@code 10.0.0.0/24}, {@code 10.0.0.1-10.0.0.20},
   * {@code 10.0.0.1-20} or {@code 10.0.0.5}.
   *
   * @param raw candidate target
   * @return validated target
   * @throws ValidationException if the expression is not a valid IP, CIDR or range
   */
  public static ScanTarget parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("scan range must not be blank");
    }
    String trimmed = raw.trim();
    try {
      if (trimmed.indexOf('/') >= 0) {
        return new ScanTarget(Net.validateCidr(trimmed), Kind.CIDR);
      }
      if (trimmed.indexOf('-') >= 0) {
        return new ScanTarget(Net.validateIpRange(trimmed), Kind.RANGE);
      }
      return new ScanTarget(Net.validateIpLiteral(trimmed), Kind.SINGLE);
    } catch (IllegalArgumentException ex) {
      throw new ValidationException("invalid scan range '" + trimmed + "': " + ex.getMessage(), ex);
    }
  }

  @Override
  public String toString() {
    return value;
  }

  /** Target shapes. */
  public enum Kind {
    SINGLE,
    CIDR,
    RANGE
  }
}
