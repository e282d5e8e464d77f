package ca.gc.cra.nmapper.config;

import ca.gc.cra.nmapper.adapter.kafka.KafkaNotificationAdapter;
import ca.gc.cra.nmapper.application.diff.SnapshotDiffEngine;
import ca.gc.cra.nmapper.application.monitoring.MonitoringOrchestrator;
import ca.gc.cra.nmapper.application.port.ClockPort;
import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.NotificationPort;
import ca.gc.cra.nmapper.application.port.ScannerPort;
import ca.gc.cra.nmapper.application.port.SnapshotStorePort;
import ca.gc.cra.nmapper.application.scheduling.ScanJobScheduler;
import ca.gc.cra.nmapper.infrastructure.json.JsonCodec;
import ca.gc.cra.nmapper.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.nmapper.infrastructure.notify.LoggingNotificationAdapter;
import ca.gc.cra.nmapper.infrastructure.persistence.jdbc.JdbcSnapshotStore;
import ca.gc.cra.nmapper.infrastructure.persistence.memory.InMemorySnapshotStore;
import ca.gc.cra.nmapper.infrastructure.scanner.CommandScannerAdapter;
import ca.gc.cra.nmapper.infrastructure.scanner.DisabledScannerAdapter;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that turns a {@link MonitorConfig} into a wired
 * {@link MonitoringOrchestrator}.
 * <p><strong>Why:</strong> Keeps adapter selection (storage, scanner, notification sink) in one place so the
 * CLI commands and tests share the same wiring.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the snapshot store ({@code storage.type}) and scanner ({@code scanner.command}).</li>
 *   <li>Select the notification sink ({@code notify.sink}).</li>
 *   <li>Build the scheduler, diff engine and orchestrator around a shared clock and metrics port.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; build the graph on a single thread during startup.
 * Adapters are created once and cached, so repeated calls return the same instances.</p>
 * <p><strong>Observability:</strong> Logs the selected adapters at INFO. {@link #close()} releases the
 * notification sink and the metrics adapter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MonitorConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final JsonCodec json = new JsonCodec();

  private SnapshotStorePort store;
  private ScannerPort scanner;
  private NotificationPort notifications;
  private ScanJobScheduler scheduler;
  private MonitoringOrchestrator orchestrator;

  /**
   * Creates a root exporting metrics through OpenTelemetry and using the system clock.
   *
   * @param config parsed configuration
   */
  public CompositionRoot(MonitorConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), ClockPort.SYSTEM);
  }

  /**
   * Creates a root with explicit metrics and clock, used by tests.
   *
   * @param config parsed configuration
   * @param metrics metrics sink shared by every component
   * @param clock time source shared by every component
   */
  public CompositionRoot(MonitorConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public MonitorConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public JsonCodec json() {
    return json;
  }

  /**
   * Snapshot store selected by {@code storage.type}. The store is not initialized; callers that bypass the
   * orchestrator lifecycle must call {@link SnapshotStorePort#initialize()} themselves.
   *
   * @return cached store
   */
  public SnapshotStorePort snapshotStore() {
    if (store == null) {
      StorageConfig storage = config.storage();
      store = switch (storage.type()) {
        case JDBC -> new JdbcSnapshotStore(storage.url(), storage.user(), storage.password(), json, metrics);
        case MEMORY -> new InMemorySnapshotStore();
      };
      log.info("Snapshot store: {}", storage);
    }
    return store;
  }

  /**
   * Scanner running {@code scanner.command}, or a disabled scanner when no command is configured.
   *
   * @return cached scanner
   */
  public ScannerPort scanner() {
    if (scanner == null) {
      ScannerConfig scannerConfig = config.scanner();
      scanner = scannerConfig.enabled()
          ? new CommandScannerAdapter(scannerConfig.command(), json, metrics)
          : new DisabledScannerAdapter();
      log.info("Scanner: {}", scanner.describe());
    }
    return scanner;
  }

  /**
   * Notification sink selected by {@code notify.sink}.
   *
   * @return cached sink
   */
  public NotificationPort notifications() {
    if (notifications == null) {
      NotificationConfig notification = config.notification();
      notifications = switch (notification.sink()) {
        case NONE -> NotificationPort.NO_OP;
        case LOG -> new LoggingNotificationAdapter(metrics);
        case KAFKA -> new KafkaNotificationAdapter(
            notification.kafkaBootstrap(), notification.kafkaTopic(), json, clock, metrics);
      };
      log.info("Notification sink: {}", notification.sink().name().toLowerCase(Locale.ROOT));
    }
    return notifications;
  }

  /**
   * Scan scheduler driving {@link #scanner()}.
   *
   * @return cached scheduler, stopped until the orchestrator starts it
   */
  public ScanJobScheduler scheduler() {
    if (scheduler == null) {
      scheduler = new ScanJobScheduler(scanner(), config.scheduler(), clock, metrics);
    }
    return scheduler;
  }

  public SnapshotDiffEngine diffEngine() {
    return new SnapshotDiffEngine(config.diff());
  }

  /**
   * Fully wired orchestrator.
   *
   * @return cached orchestrator, stopped
   */
  public MonitoringOrchestrator orchestrator() {
    if (orchestrator == null) {
      orchestrator = new MonitoringOrchestrator(
          scheduler(),
          scanner(),
          snapshotStore(),
          diffEngine(),
          notifications(),
          config.monitor(),
          clock,
          metrics);
    }
    return orchestrator;
  }

  /**
   * Stops the orchestrator if one was built, then releases the store, the notification sink and the metrics
   * adapter. Failures are logged so every resource gets its chance to close.
   */
  @Override
  public void close() {
    if (orchestrator != null) {
      try {
        orchestrator.close();
      } catch (RuntimeException ex) {
        log.warn("Orchestrator did not stop cleanly: {}", ex.getMessage(), ex);
      }
    }
    if (store != null) {
      try {
        store.close();
      } catch (RuntimeException ex) {
        log.warn("Snapshot store did not close cleanly: {}", ex.getMessage(), ex);
      }
    }
    if (notifications != null) {
      try {
        notifications.close();
      } catch (RuntimeException ex) {
        log.warn("Notification sink did not close cleanly: {}", ex.getMessage(), ex);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Metrics adapter did not close cleanly: {}", ex.getMessage(), ex);
      }
    }
  }
}
