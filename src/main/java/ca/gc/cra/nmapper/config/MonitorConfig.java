package ca.gc.cra.nmapper.config;

import ca.gc.cra.nmapper.application.diff.DeviceIdentityPolicy;
import ca.gc.cra.nmapper.application.diff.DiffOptions;
import ca.gc.cra.nmapper.application.monitoring.MonitorSettings;
import ca.gc.cra.nmapper.application.resilience.Backoff;
import ca.gc.cra.nmapper.application.scheduling.SchedulerSettings;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import ca.gc.cra.nmapper.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Fully parsed monitor configuration, the single context object handed to
 * {@link CompositionRoot}.
 * <p><strong>Keys:</strong> {@code scheduler.*} tune the scan scheduler, {@code monitor.*} the orchestrator and its
 * optional default scan, {@code storage.*}, {@code scanner.*} and {@code notify.*} select adapters. Durations accept
 * {@code 30s}, {@code 5m}, {@code 24h}, {@code 30d} or plain seconds.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param scheduler scheduler tuning
 * @param monitor orchestrator tuning
 * @param diff diff engine options
 * @param storage snapshot store selection
 * @param scanner scan command
 * @param notification notification sink
 * @since 0.1.0
 */
public record MonitorConfig(
    SchedulerSettings scheduler,
    MonitorSettings monitor,
    DiffOptions diff,
    StorageConfig storage,
    ScannerConfig scanner,
    NotificationConfig notification) {

  private static final Duration ZERO = Duration.ZERO;

  public MonitorConfig {
    Objects.requireNonNull(scheduler, "scheduler");
    Objects.requireNonNull(monitor, "monitor");
    Objects.requireNonNull(diff, "diff");
    Objects.requireNonNull(storage, "storage");
    Objects.requireNonNull(scanner, "scanner");
    Objects.requireNonNull(notification, "notification");
  }

  /**
   * Built-in defaults for every section.
   *
   * @return default configuration
   */
  public static MonitorConfig defaults() {
    return new MonitorConfig(
        SchedulerSettings.defaults(),
        MonitorSettings.defaults(),
        DiffOptions.defaults(),
        StorageConfig.defaults(),
        ScannerConfig.defaults(),
        NotificationConfig.defaults());
  }

  /**
   * Parses a merged flat map. Missing keys keep their defaults.
   *
   * @param options merged configuration
   * @return parsed configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static MonitorConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new MonitorConfig(
        schedulerFromMap(options),
        monitorFromMap(options),
        diffFromMap(options),
        StorageConfig.fromMap(options),
        ScannerConfig.fromMap(options),
        NotificationConfig.fromMap(options));
  }

  private static SchedulerSettings schedulerFromMap(Map<String, String> options) {
    SchedulerSettings defaults = SchedulerSettings.defaults();
    Duration retryDelay = duration(options, "scheduler.retryDelay",
        defaults.retryBackoff().baseDelay(), ZERO, Duration.ofHours(1));
    Duration retryMaxDelay = duration(options, "scheduler.retryMaxDelay",
        defaults.retryBackoff().maxDelay(), ZERO, Duration.ofHours(6));
    if (retryMaxDelay.compareTo(retryDelay) < 0) {
      throw new IllegalArgumentException("scheduler.retryMaxDelay must not be below scheduler.retryDelay");
    }
    Duration minInterval = duration(options, "scheduler.minInterval",
        defaults.minInterval(), Duration.ofSeconds(1), Duration.ofDays(7));
    Duration maxInterval = duration(options, "scheduler.maxInterval",
        defaults.maxInterval(), minInterval, Duration.ofDays(30));
    return new SchedulerSettings(
        integer(options, "scheduler.maxConcurrentScans", defaults.maxConcurrentScans(), 1, 32),
        integer(options, "scheduler.maxRetries", defaults.maxRetries(), 0, SchedulerSettings.MAX_RETRIES),
        Backoff.doubling(retryDelay, retryMaxDelay),
        minInterval,
        maxInterval,
        duration(options, "scheduler.scanTimeout", defaults.defaultTimeout(),
            SchedulerSettings.MIN_TIMEOUT, SchedulerSettings.MAX_TIMEOUT),
        duration(options, "scheduler.shutdownGrace", defaults.shutdownGrace(), ZERO, Duration.ofMinutes(10)),
        integer(options, "scheduler.historyLimit", defaults.historyLimit(), 1, 10_000));
  }

  private static MonitorSettings monitorFromMap(Map<String, String> options) {
    MonitorSettings defaults = MonitorSettings.defaults();
    Duration storeDelay = duration(options, "monitor.storeRetryDelay",
        defaults.storeBackoff().baseDelay(), ZERO, Duration.ofMinutes(1));
    MonitorSettings settings = new MonitorSettings(
        duration(options, "monitor.healthCheckInterval", defaults.healthCheckInterval(),
            Duration.ofSeconds(1), Duration.ofHours(1)),
        duration(options, "monitor.shutdownTimeout", defaults.gracefulShutdownTimeout(),
            ZERO, Duration.ofMinutes(10)),
        integer(options, "monitor.significantChangeThreshold", defaults.significantChangeThreshold(),
            0, 1_000_000),
        duration(options, "monitor.retention", defaults.retention(), Duration.ofHours(1), Duration.ofDays(3650)),
        null,
        integer(options, "monitor.storeAttempts", defaults.storeAttempts(), 1, 10),
        Backoff.doubling(storeDelay, max(storeDelay, defaults.storeBackoff().maxDelay())),
        integer(options, "monitor.breakerThreshold", defaults.breakerThreshold(), 1, 100),
        duration(options, "monitor.breakerResetTimeout", defaults.breakerResetTimeout(),
            Duration.ofSeconds(1), Duration.ofHours(1)));

    String range = options.get("monitor.range");
    if (range == null || range.isBlank()) {
      return settings;
    }
    String normalized;
    ScanProfile profile;
    try {
      normalized = ScanTarget.parse(range).value();
      profile = ScanProfile.from(options.get("monitor.profile"));
    } catch (ValidationException ex) {
      throw new IllegalArgumentException("monitor default scan: " + ex.getMessage(), ex);
    }
    Duration interval = duration(options, "monitor.interval", SchedulerSettings.DEFAULT_INTERVAL,
        Duration.ofSeconds(1), Duration.ofDays(30));
    return settings.withDefaultScan(new MonitorSettings.DefaultScan(normalized, interval, profile));
  }

  private static DiffOptions diffFromMap(Map<String, String> options) {
    DiffOptions defaults = DiffOptions.defaults();
    DeviceIdentityPolicy policy = DeviceIdentityPolicy.from(options.get("diff.identityPolicy"));
    String lastSeen = options.get("diff.includeLastSeen");
    boolean includeLastSeen = lastSeen == null || lastSeen.isBlank()
        ? defaults.includeLastSeen()
        : Boolean.parseBoolean(lastSeen.trim());
    return new DiffOptions(policy, defaults.detectOsChanges(), defaults.detectServiceChanges(), includeLastSeen,
        defaults.osAccuracyThreshold());
  }

  private static Duration duration(
      Map<String, String> options, String key, Duration fallback, Duration min, Duration max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseDuration(key, raw, min, max);
  }

  private static int integer(Map<String, String> options, String key, int fallback, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return (int) Numbers.parseInRange(key, raw, min, max);
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
