package ca.gc.cra.nmapper.config;

import ca.gc.cra.nmapper.application.monitoring.MonitorSettings;
import ca.gc.cra.nmapper.application.scheduling.SchedulerSettings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattened default configuration per CLI command. These maps are the lowest layer of the merge and document
 * every recognised key.
 */
public final class DefaultsForMode {
  /** Commands that accept configuration. */
  public static final Set<String> MODES = Set.of("monitor", "scan", "snapshots", "diff");

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command name ({@code monitor}, {@code scan}, {@code snapshots}, {@code diff})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = buildCommonDefaults();
    switch (normalized) {
      case "monitor" -> {
        defaults.putAll(buildSchedulerDefaults());
        defaults.putAll(buildMonitorDefaults());
        defaults.put("metricsExporter", "otlp");
      }
      case "scan" -> {
        defaults.putAll(buildSchedulerDefaults());
        defaults.put("profile", "discovery");
        defaults.put("timeout", format(SchedulerSettings.defaults().defaultTimeout()));
      }
      case "snapshots" -> {
        defaults.put("page", "1");
        defaults.put("size", "25");
        defaults.put("sortBy", "timestamp");
        defaults.put("order", "desc");
      }
      case "diff" -> defaults.put("format", "text");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    StorageConfig storage = StorageConfig.defaults();
    NotificationConfig notification = NotificationConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("storage.type", storage.type().name().toLowerCase(Locale.ROOT));
    map.put("storage.url", storage.url());
    map.put("storage.user", storage.user());
    map.put("storage.password", storage.password());
    map.put("scanner.command", "");
    map.put("notify.sink", notification.sink().name().toLowerCase(Locale.ROOT));
    map.put("notify.kafkaBootstrap", "");
    map.put("notify.kafkaTopic", notification.kafkaTopic());
    map.put("diff.identityPolicy", "ip");
    map.put("diff.includeLastSeen", "false");
    return map;
  }

  private static Map<String, String> buildSchedulerDefaults() {
    SchedulerSettings defaults = SchedulerSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("scheduler.maxConcurrentScans", Integer.toString(defaults.maxConcurrentScans()));
    map.put("scheduler.maxRetries", Integer.toString(defaults.maxRetries()));
    map.put("scheduler.retryDelay", format(defaults.retryBackoff().baseDelay()));
    map.put("scheduler.retryMaxDelay", format(defaults.retryBackoff().maxDelay()));
    map.put("scheduler.minInterval", format(defaults.minInterval()));
    map.put("scheduler.maxInterval", format(defaults.maxInterval()));
    map.put("scheduler.scanTimeout", format(defaults.defaultTimeout()));
    map.put("scheduler.shutdownGrace", format(defaults.shutdownGrace()));
    map.put("scheduler.historyLimit", Integer.toString(defaults.historyLimit()));
    return map;
  }

  private static Map<String, String> buildMonitorDefaults() {
    MonitorSettings defaults = MonitorSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("monitor.healthCheckInterval", format(defaults.healthCheckInterval()));
    map.put("monitor.shutdownTimeout", format(defaults.gracefulShutdownTimeout()));
    map.put("monitor.significantChangeThreshold", Integer.toString(defaults.significantChangeThreshold()));
    map.put("monitor.retention", format(defaults.retention()));
    map.put("monitor.storeAttempts", Integer.toString(defaults.storeAttempts()));
    map.put("monitor.storeRetryDelay", format(defaults.storeBackoff().baseDelay()));
    map.put("monitor.breakerThreshold", Integer.toString(defaults.breakerThreshold()));
    map.put("monitor.breakerResetTimeout", format(defaults.breakerResetTimeout()));
    map.put("monitor.range", "");
    map.put("monitor.interval", format(SchedulerSettings.DEFAULT_INTERVAL));
    map.put("monitor.profile", "discovery");
    return map;
  }

  static String format(Duration duration) {
    long millis = duration.toMillis();
    return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
  }
}
