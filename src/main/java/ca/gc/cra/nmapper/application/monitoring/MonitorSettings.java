package ca.gc.cra.nmapper.application.monitoring;

import ca.gc.cra.nmapper.application.resilience.Backoff;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import java.time.Duration;
import java.util.Objects;

/**
 * Orchestrator tuning handed over by the composition root.
 *
 * @param healthCheckInterval cadence of the health loop
 * @param gracefulShutdownTimeout upper bound for waiting on the event thread during shutdown
 * @param significantChangeThreshold diffs with more total changes than this raise a notification
 * @param retention snapshots older than this are removed by {@link MonitoringOrchestrator#sweepRetention()}
 * @param defaultScan recurring scan registered on start; {@code null} for none
 * @param storeAttempts attempts per store call, including the first
 * @param storeBackoff delay schedule between store attempts
 * @param breakerThreshold consecutive store failures that open the circuit breaker
 * @param breakerResetTimeout time the breaker stays open before a trial call
 * @since 0.1.0
 */
public record MonitorSettings(
    Duration healthCheckInterval,
    Duration gracefulShutdownTimeout,
    int significantChangeThreshold,
    Duration retention,
    DefaultScan defaultScan,
    int storeAttempts,
    Backoff storeBackoff,
    int breakerThreshold,
    Duration breakerResetTimeout) {

  public MonitorSettings {
    Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
    Objects.requireNonNull(gracefulShutdownTimeout, "gracefulShutdownTimeout");
    Objects.requireNonNull(retention, "retention");
    Objects.requireNonNull(storeBackoff, "storeBackoff");
    Objects.requireNonNull(breakerResetTimeout, "breakerResetTimeout");
    if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
      throw new IllegalArgumentException("healthCheckInterval must be positive");
    }
    if (significantChangeThreshold < 0) {
      throw new IllegalArgumentException("significantChangeThreshold must not be negative");
    }
    if (retention.isNegative() || retention.isZero()) {
      throw new IllegalArgumentException("retention must be positive");
    }
    if (storeAttempts < 1) {
      throw new IllegalArgumentException("storeAttempts must be >= 1");
    }
    if (breakerThreshold < 1) {
      throw new IllegalArgumentException("breakerThreshold must be >= 1");
    }
  }

  /**
   * Thirty second health cadence and shutdown window, threshold 10, thirty day retention, no default scan,
   * three store attempts from one second doubling, breaker opening after five failures for sixty seconds.
   *
   * @return default settings
   */
  public static MonitorSettings defaults() {
    return new MonitorSettings(
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        10,
        Duration.ofDays(30),
        null,
        3,
        Backoff.doubling(Duration.ofSeconds(1), Duration.ofSeconds(30)),
        5,
        Duration.ofSeconds(60));
  }

  /**
   * Copy with a different default scan.
   *
   * @param scan default scan or {@code null}
   * @return updated settings
   */
  public MonitorSettings withDefaultScan(DefaultScan scan) {
    return new MonitorSettings(healthCheckInterval, gracefulShutdownTimeout, significantChangeThreshold, retention,
        scan, storeAttempts, storeBackoff, breakerThreshold, breakerResetTimeout);
  }

  /**
   * Recurring scan registered at startup.
   *
   * @param range IP, CIDR or range to scan
   * @param interval recurrence interval
   * @param profile scan profile
   */
  public record DefaultScan(String range, Duration interval, ScanProfile profile) {
    public DefaultScan {
      Objects.requireNonNull(range, "range");
      Objects.requireNonNull(interval, "interval");
      profile = profile == null ? ScanProfile.DISCOVERY : profile;
    }
  }
}
