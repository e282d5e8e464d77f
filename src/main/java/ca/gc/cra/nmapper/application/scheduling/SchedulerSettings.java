package ca.gc.cra.nmapper.application.scheduling;

import ca.gc.cra.nmapper.application.resilience.Backoff;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link ScanJobScheduler}.
 *
 * @param maxConcurrentScans concurrency ceiling; {@code 1..32}
 * @param maxRetries retries after the first failed attempt; {@code 0..5}
 * @param retryBackoff delay schedule between attempts
 * @param minInterval smallest accepted recurring interval
 * @param maxInterval largest accepted recurring interval
 * @param defaultTimeout scan timeout used when a request does not specify one
 * @param shutdownGrace time {@code stop()} waits for in-flight scans before cancelling them
 * @param historyLimit number of executions kept in the history
 * @since 0.1.0
 */
public record SchedulerSettings(
    int maxConcurrentScans,
    int maxRetries,
    Backoff retryBackoff,
    Duration minInterval,
    Duration maxInterval,
    Duration defaultTimeout,
    Duration shutdownGrace,
    int historyLimit) {

  /** Default recurring interval. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
  /** Smallest accepted scan timeout. */
  public static final Duration MIN_TIMEOUT = Duration.ofSeconds(5);
  /** Largest accepted scan timeout. */
  public static final Duration MAX_TIMEOUT = Duration.ofMinutes(5);
  /** Largest accepted retry count. */
  public static final int MAX_RETRIES = 5;

  /**
   * Validates the settings.
   *
   * @throws IllegalArgumentException if any value is out of range
   */
  public SchedulerSettings {
    if (maxConcurrentScans < 1 || maxConcurrentScans > 32) {
      throw new IllegalArgumentException("maxConcurrentScans must be between 1 and 32");
    }
    if (maxRetries < 0 || maxRetries > MAX_RETRIES) {
      throw new IllegalArgumentException("maxRetries must be between 0 and " + MAX_RETRIES);
    }
    Objects.requireNonNull(retryBackoff, "retryBackoff");
    Objects.requireNonNull(minInterval, "minInterval");
    Objects.requireNonNull(maxInterval, "maxInterval");
    Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    Objects.requireNonNull(shutdownGrace, "shutdownGrace");
    if (minInterval.isNegative() || minInterval.isZero() || maxInterval.compareTo(minInterval) < 0) {
      throw new IllegalArgumentException("intervals must satisfy 0 < minInterval <= maxInterval");
    }
    if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
      throw new IllegalArgumentException("defaultTimeout must be positive");
    }
    if (shutdownGrace.isNegative()) {
      throw new IllegalArgumentException("shutdownGrace must not be negative");
    }
    if (historyLimit < 1) {
      throw new IllegalArgumentException("historyLimit must be >= 1");
    }
  }

  /**
   * Three concurrent scans, two retries doubling from one minute up to ten, intervals between thirty seconds and a
   * day, thirty second timeouts, thirty second grace and one hundred history entries.
   *
   * @return default settings
   */
  public static SchedulerSettings defaults() {
    return new SchedulerSettings(
        3,
        2,
        Backoff.doubling(Duration.ofMinutes(1), Duration.ofMinutes(10)),
        Duration.ofSeconds(30),
        Duration.ofHours(24),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        100);
  }
}
