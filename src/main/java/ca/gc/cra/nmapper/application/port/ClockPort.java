package ca.gc.cra.nmapper.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Wall-clock source for snapshot timestamps, schedule due times and breaker timeouts.
 * <p><strong>Why:</strong> Tests drive the circuit breaker and retention sweep with a manual clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default clock using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
