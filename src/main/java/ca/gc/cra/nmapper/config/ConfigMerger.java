package ca.gc.cra.nmapper.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings and checks cross-key rules that single-key parsing cannot see.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration with precedence CLI over YAML over defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message whenever a CLI key overrides a YAML key
   * @return immutable merged configuration
   * @throws IllegalArgumentException when a cross-key rule is violated
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("kafka".equalsIgnoreCase(trim(effective.get("notify.sink")))
        && trim(effective.get("notify.kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("notify.kafkaBootstrap is required when notify.sink=kafka");
    }
    String storage = trim(effective.get("storage.type"));
    if ((storage.isEmpty() || "jdbc".equalsIgnoreCase(storage)) && trim(effective.get("storage.url")).isEmpty()) {
      throw new IllegalArgumentException("storage.url is required when storage.type=jdbc");
    }
    if ("monitor".equalsIgnoreCase(mode) && !trim(effective.get("monitor.range")).isEmpty()
        && trim(effective.get("scanner.command")).isEmpty()) {
      throw new IllegalArgumentException("monitor.range requires scanner.command");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
