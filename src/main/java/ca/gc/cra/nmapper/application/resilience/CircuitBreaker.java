package ca.gc.cra.nmapper.application.resilience;

import ca.gc.cra.nmapper.application.port.ClockPort;
import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.domain.error.NmapperException;
import ca.gc.cra.nmapper.domain.error.ServiceUnavailableException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stateful circuit breaker guarding one class of operation.
 * <p><strong>Why:</strong> Stops hammering an unreachable store; callers fail fast with
 * {@link ServiceUnavailableException} while the breaker is open.</p>
 * <p><strong>States:</strong>
 * <ul>
 *   <li>{@code CLOSED}: calls pass through; {@code failureThreshold} consecutive failures open the breaker.</li>
 *   <li>{@code OPEN}: calls are rejected without running until {@code resetTimeout} has elapsed.</li>
 *   <li>{@code HALF_OPEN}: exactly one trial call runs; success closes the breaker, failure reopens it.</li>
 * </ul>
 * <p><strong>Failure rule:</strong> retryable {@link NmapperException}s and uncategorized runtime exceptions count
 * as failures. Non-retryable categorized exceptions (not found, validation) show the dependency answered and
 * count as successes.</p>
 * <p><strong>Thread-safety:</strong> State transitions are guarded by the instance monitor; the protected operation
 * runs outside the lock.</p>
 * <p><strong>Observability:</strong> {@code breaker.<name>.opened}, {@code breaker.<name>.rejected} and
 * {@code breaker.<name>.closed} counters.</p>
 *
 * @since 0.1.0
 */
public final class CircuitBreaker {
  private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

  private final String name;
  private final int failureThreshold;
  private final Duration resetTimeout;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private State state = State.CLOSED;
  private int consecutiveFailures;
  private long openedAtMillis;
  private boolean trialInFlight;

  /**
   * Creates a closed breaker.
   *
   * @param name operation class name used in logs and metrics
   * @param failureThreshold consecutive failures that open the breaker; at least 1
   * @param resetTimeout time the breaker stays open before admitting a trial call
   * @param clock time source
   * @param metrics metrics sink
   */
  public CircuitBreaker(
      String name, int failureThreshold, Duration resetTimeout, ClockPort clock, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    Objects.requireNonNull(resetTimeout, "resetTimeout");
    if (resetTimeout.isNegative()) {
      throw new IllegalArgumentException("resetTimeout must not be negative");
    }
    this.failureThreshold = failureThreshold;
    this.resetTimeout = resetTimeout;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Runs {@code operation} if the breaker admits it.
   *
   * @param operation protected operation
   * @param <T> result type
   * @return operation result
   * @throws ServiceUnavailableException if the breaker is open or a half-open trial is already running
   */
  public <T> T execute(Supplier<T> operation) {
    Objects.requireNonNull(operation, "operation");
    acquirePermission();
    T result;
    try {
      result = operation.get();
    } catch (RuntimeException ex) {
      if (countsAsFailure(ex)) {
        onFailure(ex);
      } else {
        onSuccess();
      }
      throw ex;
    }
    onSuccess();
    return result;
  }

  /**
   * Runs an operation without a result.
   *
   * @param operation protected operation
   */
  public void run(Runnable operation) {
    Objects.requireNonNull(operation, "operation");
    execute(() -> {
      operation.run();
      return null;
    });
  }

  /**
   * Current state; an open breaker whose timeout elapsed still reports {@link State#OPEN} until the next call.
   *
   * @return breaker state
   */
  public synchronized State state() {
    return state;
  }

  /**
   * Consecutive failures counted since the last success.
   *
   * @return failure count
   */
  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  /**
   * Operation class name.
   *
   * @return breaker name
   */
  public String name() {
    return name;
  }

  private synchronized void acquirePermission() {
    if (state == State.OPEN) {
      long elapsed = clock.nowMillis() - openedAtMillis;
      if (elapsed < resetTimeout.toMillis()) {
        reject("open");
      }
      state = State.HALF_OPEN;
      trialInFlight = false;
      log.info("Circuit breaker {} half-open after {} ms", name, elapsed);
    }
    if (state == State.HALF_OPEN) {
      if (trialInFlight) {
        reject("half-open trial in progress");
      }
      trialInFlight = true;
    }
  }

  private void reject(String reason) {
    metrics.increment("breaker." + name + ".rejected");
    throw new ServiceUnavailableException("circuit breaker " + name + " is " + reason);
  }

  private synchronized void onSuccess() {
    if (state != State.CLOSED) {
      log.info("Circuit breaker {} closed", name);
      metrics.increment("breaker." + name + ".closed");
    }
    state = State.CLOSED;
    consecutiveFailures = 0;
    trialInFlight = false;
  }

  private synchronized void onFailure(RuntimeException ex) {
    consecutiveFailures++;
    if (state == State.HALF_OPEN || consecutiveFailures >= failureThreshold) {
      if (state != State.OPEN) {
        log.warn("Circuit breaker {} opened after {} consecutive failures: {}",
            name, consecutiveFailures, ex.getMessage());
        metrics.increment("breaker." + name + ".opened");
      }
      state = State.OPEN;
      openedAtMillis = clock.nowMillis();
      trialInFlight = false;
    }
  }

  private static boolean countsAsFailure(RuntimeException ex) {
    if (ex instanceof NmapperException categorized) {
      return categorized.retryable();
    }
    return true;
  }

  /** Breaker states. */
  public enum State {
    CLOSED,
    OPEN,
    HALF_OPEN
  }
}
