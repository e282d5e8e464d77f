package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} (or {@code --key=value}) arguments into an ordered map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final int MAX_VALUE_LENGTH = 4_096;

  private CliArgsParser() {}

  /**
   * Splits every argument on its first {@code '='}. Later occurrences of a key replace earlier ones.
   *
   * @param args arguments without the command word; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is not {@code key=value}, the key is malformed or the value
   *     holds control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      if (arg.startsWith("--")) {
        arg = arg.substring(2);
      }
      int eq = arg.indexOf('=');
      if (eq <= 0 || eq == arg.length() - 1) {
        throw new IllegalArgumentException("expected key=value but got '" + Strings.abbreviate(raw, 64) + "'");
      }
      String key = arg.substring(0, eq).trim();
      String value = arg.substring(eq + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid option name: " + Strings.abbreviate(key, 64));
      }
      if (value.length() > MAX_VALUE_LENGTH) {
        throw new IllegalArgumentException(key + " is longer than " + MAX_VALUE_LENGTH + " characters");
      }
      for (int i = 0; i < value.length(); i++) {
        if (Character.isISOControl(value.charAt(i))) {
          throw new IllegalArgumentException(key + " must not contain control characters");
        }
      }
      map.put(key, value);
    }
    return map;
  }
}
