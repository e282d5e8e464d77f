package ca.gc.cra.nmapper.application.resilience;

import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.domain.error.NmapperException;
import ca.gc.cra.nmapper.domain.error.ServiceUnavailableException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Retries transient failures with exponential backoff.
 * <p><strong>Retry rule:</strong> a failure is retried when it is a {@link NmapperException} whose
 * {@link NmapperException#retryable()} is {@code true}, or any other {@link RuntimeException}. Non-retryable
 * categorized failures (validation, not found, open breaker) propagate immediately.</p>
 * <p><strong>Exhaustion:</strong> after {@code maxAttempts} failed attempts a {@link ServiceUnavailableException}
 * wrapping the last failure is thrown.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class RetryPolicy {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  private final String name;
  private final int maxAttempts;
  private final Backoff backoff;
  private final Sleeper sleeper;
  private final MetricsPort metrics;

  /**
   * Creates a policy.
   *
   * @param name operation class name used in logs and metric keys (e.g. {@code store})
   * @param maxAttempts total attempts including the first; at least 1
   * @param backoff delay schedule between attempts
   * @param sleeper delay implementation; tests pass a recording sleeper
   * @param metrics metrics sink
   */
  public RetryPolicy(String name, int maxAttempts, Backoff backoff, Sleeper sleeper, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Policy with three attempts, one second base delay and doubling up to thirty seconds.
   *
   * @param name operation class name
   * @param metrics metrics sink
   * @return default policy
   */
  public static RetryPolicy defaults(String name, MetricsPort metrics) {
    return new RetryPolicy(
        name, 3, new Backoff(Duration.ofSeconds(1), 2.0d, Duration.ofSeconds(30)), Sleeper.THREAD, metrics);
  }

  /**
   * Runs {@code operation}, retrying transient failures.
   *
   * @param operation operation to run
   * @param <T> result type
   * @return operation result
   * @throws InterruptedException if interrupted while waiting between attempts
   * @throws ServiceUnavailableException when every attempt failed
   */
  public <T> T execute(Supplier<T> operation) throws InterruptedException {
    Objects.requireNonNull(operation, "operation");
    RuntimeException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return operation.get();
      } catch (RuntimeException ex) {
        if (!isRetryable(ex)) {
          throw ex;
        }
        last = ex;
        metrics.increment("retry." + name + ".failure");
        if (attempt < maxAttempts) {
          Duration delay = backoff.delayBefore(attempt);
          log.warn("{} attempt {}/{} failed: {}; retrying in {} ms",
              name, attempt, maxAttempts, ex.getMessage(), delay.toMillis());
          sleeper.sleep(delay);
        }
      }
    }
    metrics.increment("retry." + name + ".exhausted");
    throw new ServiceUnavailableException(
        name + " unavailable after " + maxAttempts + " attempts: " + last.getMessage(), last);
  }

  /**
   * Runs an operation without a result.
   *
   * @param operation operation to run
   * @throws InterruptedException if interrupted while waiting between attempts
   */
  public void run(Runnable operation) throws InterruptedException {
    Objects.requireNonNull(operation, "operation");
    execute(() -> {
      operation.run();
      return null;
    });
  }

  /**
   * Total attempts this policy makes.
   *
   * @return attempt count
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  static boolean isRetryable(RuntimeException ex) {
    if (ex instanceof NmapperException categorized) {
      return categorized.retryable();
    }
    return true;
  }
}
