package ca.gc.cra.nmapper.application.resilience;

import java.time.Duration;

/**
 * Blocking delay used between retry attempts.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks for {@code duration}.
   *
   * @param duration delay
   * @throws InterruptedException if interrupted while waiting
   */
  void sleep(Duration duration) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
