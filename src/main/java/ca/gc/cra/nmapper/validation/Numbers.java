package ca.gc.cra.nmapper.validation;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing and scheduler settings.
 * <p><strong>Why:</strong> Rejects out-of-range intervals, timeouts, retry counts and pool sizes before any
 * scheduler thread or connection is created.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g. ms, attempts)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal string and validates it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is blank, not numeric or out of range
   */
  public static long parseInRange(String name, String raw, long min, long max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + raw.trim() + ")", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Parses a duration such as {@code 250ms}, {@code 30s}, {@code 5m}, {@code 24h} or {@code 30d}; a bare number
   * is read as seconds. ISO-8601 text ({@code PT5M}) is accepted as well.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw text to parse
   * @param min smallest accepted duration
   * @param max largest accepted duration
   * @return parsed duration
   * @throws IllegalArgumentException if {@code raw} is blank, malformed or out of range
   */
  public static Duration parseDuration(String name, String raw, Duration min, Duration max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    String text = raw.trim().toLowerCase(Locale.ROOT);
    Duration value;
    try {
      if (text.startsWith("p")) {
        value = Duration.parse(text.toUpperCase(Locale.ROOT));
      } else if (text.endsWith("ms")) {
        value = Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
      } else {
        char unit = text.charAt(text.length() - 1);
        String digits = Character.isDigit(unit) ? text : text.substring(0, text.length() - 1).trim();
        long amount = Long.parseLong(digits);
        value = switch (unit) {
          case 's' -> Duration.ofSeconds(amount);
          case 'm' -> Duration.ofMinutes(amount);
          case 'h' -> Duration.ofHours(amount);
          case 'd' -> Duration.ofDays(amount);
          default -> {
            if (!Character.isDigit(unit)) {
              throw new IllegalArgumentException(label(name) + " has unknown unit '" + unit + "'");
            }
            yield Duration.ofSeconds(amount);
          }
        };
      }
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new IllegalArgumentException(label(name) + " must be a duration like 30s or 5m (was " + raw.trim() + ")",
          ex);
    }
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
