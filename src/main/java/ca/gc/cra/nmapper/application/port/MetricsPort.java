package ca.gc.cra.nmapper.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the scheduler, store and orchestrator.
 * <p><strong>Why:</strong> Lets the monitoring core record counters and durations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; tests use recording fakes.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from scan workers, the
 * dispatch thread and the health loop.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code scheduler.scan.durationMillis},
 * {@code monitor.snapshot.stored}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g. {@code scheduler.scan.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (milliseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
