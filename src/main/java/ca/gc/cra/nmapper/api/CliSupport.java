package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.config.ConfigMerger;
import ca.gc.cra.nmapper.config.DefaultsForMode;
import ca.gc.cra.nmapper.config.MonitorConfig;
import ca.gc.cra.nmapper.config.YamlConfigLoader;
import ca.gc.cra.nmapper.domain.error.NmapperException;
import ca.gc.cra.nmapper.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Steps shared by every command: logging flags, the defaults &lt; YAML &lt; CLI merge, telemetry properties and
 * the mapping of failures onto exit codes.
 */
final class CliSupport {

  private CliSupport() {}

  static void applyLogging(CliInput input, Logger log, String command) {
    if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    } else if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }
  }

  /**
   * Builds the effective flat configuration for a command.
   *
   * @param mode command name, also the YAML section read besides {@code common}
   * @param input parsed arguments
   * @param usage one-line usage printed on argument errors
   * @param log command logger
   * @return mutable merged configuration
   * @throws CliAbort carrying {@link ExitCode#INVALID_ARGS} or {@link ExitCode#IO_ERROR}
   */
  static Map<String, String> effectiveConfig(String mode, CliInput input, String usage, Logger log)
      throws CliAbort {
    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.arguments());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = loadYaml(configPath, mode, usage, log);
    try {
      Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
          mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
      return new LinkedHashMap<>(merged);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Applies telemetry properties and parses the typed configuration.
   *
   * @param effective merged configuration; telemetry keys are removed from it
   * @param usage one-line usage printed on errors
   * @param log command logger
   * @return typed configuration
   * @throws CliAbort carrying {@link ExitCode#INVALID_ARGS}
   */
  static MonitorConfig monitorConfig(Map<String, String> effective, String usage, Logger log) throws CliAbort {
    try {
      TelemetryConfigurator.configureMetrics(effective);
      return MonitorConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Logs a failure and picks its exit code. Domain failures map by category; other argument errors raised
   * while building adapters count as configuration errors.
   *
   * @param ex failure
   * @param log command logger
   * @param action what was being attempted, for the log line
   * @return exit code
   */
  static ExitCode failure(RuntimeException ex, Logger log, String action) {
    if (ex instanceof NmapperException domain) {
      ExitCode code = ExitCode.forError(domain);
      log.error("{} failed ({}): {}", action, domain.category(), domain.getMessage());
      log.debug("{} failure detail", action, domain);
      return code;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("{} configuration error: {}", action, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    log.error("Unexpected runtime failure during {}", action, ex);
    return ExitCode.RUNTIME_FAILURE;
  }

  static ExitCode interrupted(InterruptedException ex, Logger log, String action) {
    Thread.currentThread().interrupt();
    log.error("{} interrupted", action, ex);
    return ExitCode.INTERRUPTED;
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static String option(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> options, String key, boolean defaultValue) {
    String value = option(options, key);
    return value == null ? defaultValue : Boolean.parseBoolean(value);
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage, Logger log)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path path = Path.of(configPath);
    if (!Files.exists(path)) {
      log.error("Configuration file does not exist: {}", path);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(path, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", path, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /** Early exit carrying the code the command should return. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;

    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
