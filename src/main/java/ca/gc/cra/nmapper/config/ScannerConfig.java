package ca.gc.cra.nmapper.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * External scan command template.
 *
 * @param command executable and argument tokens; empty disables scanning
 * @since 0.1.0
 */
public record ScannerConfig(List<String> command) {

  public ScannerConfig {
    command = command == null ? List.of() : List.copyOf(command);
  }

  /**
   * No scanner configured.
   *
   * @return disabled scanner settings
   */
  public static ScannerConfig defaults() {
    return new ScannerConfig(List.of());
  }

  /**
   * Reads {@code scanner.command}, a whitespace-separated template such as
   * {@code nmap-json --profile {profile} {target}}.
   *
   * @param options flat configuration
   * @return parsed settings
   */
  public static ScannerConfig fromMap(Map<String, String> options) {
    String raw = options.get("scanner.command");
    if (raw == null || raw.isBlank()) {
      return defaults();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : raw.trim().split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return new ScannerConfig(tokens);
  }

  /**
   * Indicates whether a command is configured.
   *
   * @return {@code true} when scans can be attempted
   */
  public boolean enabled() {
    return !command.isEmpty();
  }
}
