package ca.gc.cra.nmapper.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene for scanner output and configuration dumps.
 * <p><strong>Why:</strong> Scanner stderr can run to megabytes and database passwords must never reach the console.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Cuts a string down to {@code maxBytes} UTF-8 bytes and notes the original size.
   *
   * @param value string to shorten; {@code null} becomes {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value unchanged when it fits, otherwise a prefix followed by {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = chars.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Replaces a secret with a fixed placeholder. Blank or missing values stay visible as empty so operators can
   * tell an unset password from a set one.
   *
   * @param value secret value
   * @return {@code ""} for blank input, otherwise {@code "[REDACTED]"}
   */
  public static String redact(String value) {
    return value == null || value.isBlank() ? "" : REDACTED_PLACEHOLDER;
  }
}
