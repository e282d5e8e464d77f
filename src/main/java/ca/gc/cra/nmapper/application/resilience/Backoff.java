package ca.gc.cra.nmapper.application.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential backoff schedule.
 *
 * @param baseDelay delay before the first retry
 * @param multiplier growth factor applied per retry; at least 1
 * @param maxDelay cap for any single delay
 * @since 0.1.0
 */
public record Backoff(Duration baseDelay, double multiplier, Duration maxDelay) {

  public Backoff {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    if (multiplier < 1.0d || Double.isNaN(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay");
    }
  }

  /**
   * Doubling backoff capped at {@code maxDelay}.
   *
   * @param baseDelay first delay
   * @param maxDelay cap
   * @return doubling schedule
   */
  public static Backoff doubling(Duration baseDelay, Duration maxDelay) {
    return new Backoff(baseDelay, 2.0d, maxDelay);
  }

  /**
   * Delay before retry number {@code retry} (1 for the first retry).
   *
   * @param retry one-based retry index
   * @return delay, never above {@link #maxDelay()}
   */
  public Duration delayBefore(int retry) {
    if (retry < 1) {
      throw new IllegalArgumentException("retry must be >= 1");
    }
    double millis = baseDelay.toMillis() * Math.pow(multiplier, retry - 1);
    long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
    return Duration.ofMillis(capped);
  }
}
