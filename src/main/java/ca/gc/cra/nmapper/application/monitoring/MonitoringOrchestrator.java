package ca.gc.cra.nmapper.application.monitoring;

import ca.gc.cra.nmapper.application.diff.SnapshotDiffEngine;
import ca.gc.cra.nmapper.application.port.ClockPort;
import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.NotificationPort;
import ca.gc.cra.nmapper.application.port.Page;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.ScanStatistics;
import ca.gc.cra.nmapper.application.port.ScannerPort;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.application.port.SnapshotStorePort;
import ca.gc.cra.nmapper.application.resilience.CircuitBreaker;
import ca.gc.cra.nmapper.application.resilience.RetryPolicy;
import ca.gc.cra.nmapper.application.resilience.Sleeper;
import ca.gc.cra.nmapper.application.scheduling.ScanEvent;
import ca.gc.cra.nmapper.application.scheduling.ScanJobScheduler;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.error.ServiceUnavailableException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.error.WrongStateException;
import ca.gc.cra.nmapper.domain.monitoring.ComponentHealth;
import ca.gc.cra.nmapper.domain.monitoring.HealthStatus;
import ca.gc.cra.nmapper.domain.monitoring.MonitoringMetrics;
import ca.gc.cra.nmapper.domain.monitoring.OrchestratorState;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.infrastructure.exec.ExecutorFactories;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns the monitor lifecycle and turns scan results into stored snapshots and diffs.
 * <p><strong>Why:</strong> The single entry point for the CLI; everything else is wired behind it.</p>
 * <p><strong>Lifecycle:</strong> {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}; a failed
 * transition lands in {@code ERROR}, left through {@link #restart()} or {@link #stop()}. Calling
 * {@link #start()} or {@link #stop()} while a transition is in progress fails with {@link WrongStateException}.</p>
 * <p><strong>Pipeline:</strong> scan events are handled one at a time on a dedicated thread in completion order:
 * the latest stored snapshot is read, the new snapshot persisted, the diff computed and persisted, counters
 * updated, and a significant-change notification raised when the diff exceeds the configured threshold.</p>
 * <p><strong>Resilience:</strong> every store call runs through one shared {@link RetryPolicy} wrapping one
 * shared {@link CircuitBreaker}.</p>
 * <p><strong>Thread-safety:</strong> Public methods are safe to call from any thread.</p>
 * <p><strong>Observability:</strong> {@code monitor.*} metrics; MDC keys {@code pipeline} and
 * {@code snapshot} on the event thread.</p>
 *
 * @since 0.1.0
 */
public final class MonitoringOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MonitoringOrchestrator.class);

  /** Health component names. */
  public static final String STORAGE = "storage";
  public static final String SCANNER = "scanner";
  public static final String SNAPSHOTS = "snapshots";
  public static final String CONFIGURATION = "configuration";

  /** Largest look-back accepted by {@link #getRecentChanges(int)}: one year. */
  public static final int MAX_RECENT_HOURS = 24 * 365;

  private static final long EVENT_POLL_MILLIS = 200L;
  private static final Duration RETENTION_SWEEP_INTERVAL = Duration.ofHours(24);
  private static final int STALE_INTERVAL_FACTOR = 3;

  private final ScanJobScheduler scheduler;
  private final ScannerPort scanner;
  private final SnapshotStorePort store;
  private final SnapshotDiffEngine diffEngine;
  private final NotificationPort notifications;
  private final MonitorSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RetryPolicy storeRetry;
  private final CircuitBreaker storeBreaker;

  private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.STOPPED);
  private final LongAdder totalScans = new LongAdder();
  private final LongAdder scansCompleted = new LongAdder();
  private final LongAdder scanErrors = new LongAdder();
  private final LongAdder devicesDiscovered = new LongAdder();
  private final LongAdder changesDetected = new LongAdder();
  private final LongAdder snapshotsStored = new LongAdder();
  private final LongAdder errorsEncountered = new LongAdder();
  private final LongAdder scanDurationTotal = new LongAdder();

  private volatile long startedAtMillis;
  private volatile int totalDevices;
  private volatile Instant lastScanTime;
  private volatile HealthStatus lastHealth;
  private volatile String configurationError;
  private volatile boolean eventsRunning;
  private volatile long lastRetentionSweepMillis;
  private volatile String defaultScanJobId;
  private ExecutorService eventThread;
  private ScheduledExecutorService healthTicker;

  /**
   * Creates a stopped orchestrator.
   *
   * @param scheduler scan scheduler whose events are consumed
   * @param scanner scanner, probed by the health loop
   * @param store snapshot store
   * @param diffEngine diff engine
   * @param notifications significant-change and scan-failure sink
   * @param settings orchestrator tuning
   * @param clock time source
   * @param metrics metrics sink
   */
  public MonitoringOrchestrator(
      ScanJobScheduler scheduler,
      ScannerPort scanner,
      SnapshotStorePort store,
      SnapshotDiffEngine diffEngine,
      NotificationPort notifications,
      MonitorSettings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this(scheduler, scanner, store, diffEngine, notifications, settings, clock, metrics, Sleeper.THREAD);
  }

  MonitoringOrchestrator(
      ScanJobScheduler scheduler,
      ScannerPort scanner,
      SnapshotStorePort store,
      SnapshotDiffEngine diffEngine,
      NotificationPort notifications,
      MonitorSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      Sleeper sleeper) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.store = Objects.requireNonNull(store, "store");
    this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
    this.notifications = Objects.requireNonNullElse(notifications, NotificationPort.NO_OP);
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.storeRetry = new RetryPolicy(
        "store", settings.storeAttempts(), settings.storeBackoff(), sleeper, this.metrics);
    this.storeBreaker = new CircuitBreaker(
        "store", settings.breakerThreshold(), settings.breakerResetTimeout(), clock, this.metrics);
  }

  /**
   * Starts the monitor: store connectivity and migrations, event subscription, health loop, scheduler dispatch
   * and the default recurring scan, in that order. No-op when already running.
   *
   * @throws WrongStateException if a transition is in progress or the orchestrator is in {@code ERROR}
   * @throws RuntimeException the failure of the first step that failed; the state becomes {@code ERROR}
   */
  public void start() {
    OrchestratorState current = state.get();
    if (current == OrchestratorState.RUNNING) {
      return;
    }
    if (current == OrchestratorState.ERROR) {
      throw new WrongStateException("orchestrator is in error state; call restart()");
    }
    if (current.transitioning() || !state.compareAndSet(OrchestratorState.STOPPED, OrchestratorState.STARTING)) {
      throw new WrongStateException("orchestrator is " + state.get().name().toLowerCase());
    }
    log.info("Starting network monitor");
    try {
      storeCall(() -> {
        store.initialize();
        return null;
      });
      log.info("Snapshot store ready");

      eventsRunning = true;
      eventThread = ExecutorFactories.newSingleThread("nmapper-events", this::onUncaught);
      eventThread.execute(this::eventLoop);

      healthTicker = ExecutorFactories.newTicker("nmapper-health", this::onUncaught);
      healthTicker.scheduleWithFixedDelay(this::runHealthCheck, 0L,
          settings.healthCheckInterval().toMillis(), TimeUnit.MILLISECONDS);

      scheduler.start();
      registerDefaultScan();

      startedAtMillis = clock.nowMillis();
      state.set(OrchestratorState.RUNNING);
      metrics.increment("monitor.start.success");
      log.info("Network monitor running");
    } catch (RuntimeException ex) {
      metrics.increment("monitor.start.failed");
      log.error("Network monitor failed to start: {}", ex.getMessage(), ex);
      teardown();
      state.set(OrchestratorState.ERROR);
      throw ex;
    }
  }

  /**
   * Stops the health loop, the scheduler (with its grace window), the event thread and the store connection.
   * Idempotent when already stopped; also clears {@code ERROR}.
   *
   * @throws WrongStateException if a transition is in progress
   */
  public void stop() {
    OrchestratorState current = state.get();
    if (current == OrchestratorState.STOPPED) {
      return;
    }
    if (current.transitioning() || !state.compareAndSet(current, OrchestratorState.STOPPING)) {
      throw new WrongStateException("orchestrator is " + state.get().name().toLowerCase());
    }
    log.info("Stopping network monitor");
    try {
      teardown();
      state.set(OrchestratorState.STOPPED);
      log.info("Network monitor stopped");
    } catch (RuntimeException ex) {
      state.set(OrchestratorState.ERROR);
      log.error("Network monitor failed to stop cleanly", ex);
      throw ex;
    }
  }

  /**
   * Stops (from {@code RUNNING} or {@code ERROR}) and starts again.
   *
   * @throws WrongStateException if a transition is in progress
   */
  public void restart() {
    if (state.get().transitioning()) {
      throw new WrongStateException("orchestrator is " + state.get().name().toLowerCase());
    }
    log.info("Restarting network monitor");
    stop();
    start();
  }

  @Override
  public void close() {
    stop();
  }

  /**
   * Current lifecycle state.
   *
   * @return state
   */
  public OrchestratorState state() {
    return state.get();
  }

  /**
   * Scheduler used for recurring scans; exposes schedule management to the CLI.
   *
   * @return scheduler
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Schedule management operates on the live scheduler.")
  public ScanJobScheduler scheduler() {
    return scheduler;
  }

  /**
   * Runs a scan now and waits until its snapshot has been stored and diffed.
   *
   * @param range target range; {@code null} uses the configured default scan range
   * @param profile scan profile; {@code null} uses discovery
   * @param timeout scan timeout; {@code null} uses the scheduler default
   * @return stored snapshot
   * @throws ValidationException if no range is given and none is configured, or the input is invalid
   * @throws ScanException if the scan failed after all retries
   * @throws ServiceUnavailableException if the snapshot could not be stored
   * @throws WrongStateException if the orchestrator is not running
   * @throws InterruptedException if interrupted while waiting
   */
  public NetworkSnapshot triggerManualScan(String range, ScanProfile profile, Duration timeout)
      throws InterruptedException {
    requireRunning();
    String effectiveRange = range;
    if (effectiveRange == null || effectiveRange.isBlank()) {
      MonitorSettings.DefaultScan defaults = settings.defaultScan();
      if (defaults == null) {
        throw new ValidationException("range is required when no default scan is configured");
      }
      effectiveRange = defaults.range();
    }
    CompletableFuture<ScanEvent.Completed> submitted = scheduler.submitManual(effectiveRange, profile, timeout);
    ScanEvent.Completed completed = await(submitted);
    await(completed.handled());
    return completed.snapshot();
  }

  /**
   * Latest stored snapshot.
   *
   * @return latest snapshot, or empty when none are stored
   */
  public Optional<NetworkSnapshot> getLatestSnapshot() {
    return storeCall(store::getLatest);
  }

  /**
   * Loads one snapshot.
   *
   * @param id snapshot id
   * @return snapshot
   * @throws NotFoundException if absent
   */
  public NetworkSnapshot getSnapshot(String id) {
    return storeCall(() -> store.getById(id));
  }

  /**
   * Lists stored snapshots.
   *
   * @param query filter and ordering
   * @param page pagination
   * @return page of snapshots
   */
  public Page<NetworkSnapshot> listSnapshots(SnapshotQuery query, PageRequest page) {
    SnapshotQuery effectiveQuery = query == null ? SnapshotQuery.all() : query;
    PageRequest effectivePage = page == null ? PageRequest.first() : page;
    return storeCall(() -> store.list(effectiveQuery, effectivePage));
  }

  /**
   * Compares two stored snapshots, reusing a stored diff when one exists and storing a newly computed one.
   *
   * @param fromId older snapshot id
   * @param toId newer snapshot id
   * @return diff; empty when both ids are equal
   * @throws NotFoundException if either snapshot is absent
   */
  public SnapshotDiff compareSnapshots(String fromId, String toId) {
    if (fromId == null || toId == null) {
      throw new ValidationException("both snapshot ids are required");
    }
    if (!fromId.equals(toId)) {
      Optional<SnapshotDiff> stored = storeCall(() -> store.getDiff(fromId, toId));
      if (stored.isPresent()) {
        return stored.get();
      }
    }
    NetworkSnapshot from = storeCall(() -> store.getById(fromId));
    NetworkSnapshot to = storeCall(() -> store.getById(toId));
    SnapshotDiff diff = diffEngine.diff(from, to);
    if (!diff.comparesSameSnapshot()) {
      storeCall(() -> store.createDiff(diff));
    }
    return diff;
  }

  /**
   * Diffs computed within the last {@code sinceHours} hours, oldest first.
   *
   * @param sinceHours look-back window; {@code 1..MAX_RECENT_HOURS}
   * @return diffs
   * @throws ValidationException if the window is out of range
   */
  public List<SnapshotDiff> getRecentChanges(int sinceHours) {
    if (sinceHours < 1 || sinceHours > MAX_RECENT_HOURS) {
      throw new ValidationException("sinceHours must be between 1 and " + MAX_RECENT_HOURS);
    }
    Instant since = clock.now().minus(Duration.ofHours(sinceHours));
    return storeCall(() -> store.listRecentDiffs(since));
  }

  /**
   * Per-target scan statistics aggregated by the store.
   *
   * @return statistics ordered by target
   */
  public List<ScanStatistics> getStatistics() {
    return storeCall(store::statistics);
  }

  /**
   * Health computed by the last health-loop tick, or a fresh check when none ran yet. Outside {@code RUNNING}
   * every component reports down and the store is not contacted.
   *
   * @return health status
   */
  public HealthStatus getHealth() {
    OrchestratorState current = state.get();
    if (current != OrchestratorState.RUNNING) {
      Instant now = clock.now();
      String message = "orchestrator " + current.name().toLowerCase();
      return HealthStatus.of(now, List.of(
          ComponentHealth.down(STORAGE, now, message),
          ComponentHealth.down(SCANNER, now, message),
          ComponentHealth.down(SNAPSHOTS, now, message),
          ComponentHealth.down(CONFIGURATION, now, message)));
    }
    HealthStatus health = lastHealth;
    return health != null ? health : checkHealth();
  }

  /**
   * Running counters.
   *
   * @return metrics view
   */
  public MonitoringMetrics getMetrics() {
    long completed = scansCompleted.sum();
    long uptime = state.get() == OrchestratorState.RUNNING ? clock.nowMillis() - startedAtMillis : 0L;
    return new MonitoringMetrics(
        Math.max(0L, uptime),
        totalScans.sum(),
        completed,
        scanErrors.sum(),
        totalDevices,
        devicesDiscovered.sum(),
        changesDetected.sum(),
        snapshotsStored.sum(),
        errorsEncountered.sum(),
        scheduler.metrics().activeSchedules(),
        lastScanTime,
        completed == 0 ? 0L : scanDurationTotal.sum() / completed);
  }

  /**
   * Deletes snapshots older than the retention window.
   *
   * @return number of snapshots deleted
   */
  public int sweepRetention() {
    Instant cutoff = clock.now().minus(settings.retention());
    int deleted = storeCall(() -> store.deleteOlderThan(cutoff));
    lastRetentionSweepMillis = clock.nowMillis();
    metrics.observe("monitor.retention.deleted", deleted);
    if (deleted > 0) {
      log.info("Retention sweep removed {} snapshots older than {}", deleted, cutoff);
    }
    return deleted;
  }

  /**
   * Probes every component and caches the result for {@link #getHealth()}.
   *
   * @return fresh health status
   */
  public HealthStatus checkHealth() {
    Instant now = clock.now();
    List<ComponentHealth> components = new ArrayList<>(4);

    ComponentHealth storage;
    try {
      storeBreaker.run(store::ping);
      storage = ComponentHealth.up(STORAGE, now);
    } catch (RuntimeException ex) {
      storage = ComponentHealth.down(STORAGE, now, ex.getMessage());
    }
    components.add(storage);

    components.add(scanner.available()
        ? ComponentHealth.up(SCANNER, now, scanner.describe())
        : ComponentHealth.down(SCANNER, now, "scanner unavailable: " + scanner.describe()));

    components.add(snapshotHealth(now, storage.healthy()));

    String configError = configurationError;
    components.add(configError == null
        ? ComponentHealth.up(CONFIGURATION, now)
        : ComponentHealth.down(CONFIGURATION, now, configError));

    HealthStatus health = HealthStatus.of(now, components);
    for (ComponentHealth component : components) {
      metrics.observe("monitor.health." + component.name(), component.healthy() ? 1 : 0);
    }
    HealthStatus previous = lastHealth;
    if (previous != null && previous.status() != health.status()) {
      log.warn("Health changed from {} to {}", previous.status(), health.status());
    }
    lastHealth = health;
    return health;
  }

  CircuitBreaker storeBreaker() {
    return storeBreaker;
  }

  private ComponentHealth snapshotHealth(Instant now, boolean storageHealthy) {
    if (!storageHealthy) {
      return ComponentHealth.down(SNAPSHOTS, now, "storage unreachable");
    }
    Optional<NetworkSnapshot> latest;
    try {
      latest = storeBreaker.execute(store::getLatest);
    } catch (RuntimeException ex) {
      return ComponentHealth.down(SNAPSHOTS, now, ex.getMessage());
    }
    if (latest.isEmpty()) {
      return ComponentHealth.up(SNAPSHOTS, now, "no snapshots yet");
    }
    NetworkSnapshot snapshot = latest.get();
    totalDevices = snapshot.deviceCount();
    MonitorSettings.DefaultScan defaults = settings.defaultScan();
    if (defaults != null) {
      Duration age = Duration.between(snapshot.timestamp(), now);
      if (age.compareTo(defaults.interval().multipliedBy(STALE_INTERVAL_FACTOR)) > 0) {
        return ComponentHealth.down(SNAPSHOTS, now, "latest snapshot is " + age.toMinutes() + " minutes old");
      }
    }
    return ComponentHealth.up(SNAPSHOTS, now,
        "latest " + snapshot.id() + " with " + snapshot.deviceCount() + " devices");
  }

  private void runHealthCheck() {
    try {
      checkHealth();
      metrics.observe("monitor.devices.total", totalDevices);
      if (clock.nowMillis() - lastRetentionSweepMillis >= RETENTION_SWEEP_INTERVAL.toMillis()) {
        sweepRetention();
      }
    } catch (RuntimeException ex) {
      errorsEncountered.increment();
      metrics.increment("monitor.health.failed");
      log.warn("Health check failed: {}", ex.getMessage(), ex);
    }
  }

  private void registerDefaultScan() {
    MonitorSettings.DefaultScan defaults = settings.defaultScan();
    if (defaults == null) {
      return;
    }
    try {
      defaultScanJobId =
          scheduler.schedule("default", defaults.range(), defaults.interval(), defaults.profile(), true);
      configurationError = null;
    } catch (ValidationException ex) {
      configurationError = "default scan rejected: " + ex.getMessage();
      throw ex;
    }
  }

  private void eventLoop() {
    MDC.put("pipeline", "events");
    try {
      while (eventsRunning || !scheduler.events().isEmpty()) {
        ScanEvent event = scheduler.events().poll(EVENT_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (event == null) {
          continue;
        }
        if (event instanceof ScanEvent.Completed completed) {
          handleCompleted(completed);
        } else if (event instanceof ScanEvent.Failed failed) {
          handleFailed(failed);
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void handleCompleted(ScanEvent.Completed event) {
    NetworkSnapshot snapshot = event.snapshot();
    MDC.put("snapshot", snapshot.id());
    totalScans.increment();
    scansCompleted.increment();
    scanDurationTotal.add(snapshot.metadata().scanDurationMillis());
    lastScanTime = snapshot.timestamp();
    try {
      processSnapshot(snapshot);
      event.handled().complete(null);
    } catch (RuntimeException ex) {
      errorsEncountered.increment();
      metrics.increment("monitor.pipeline.failed");
      log.error("Failed to process snapshot {} from {}: {}", snapshot.id(), event.jobId(), ex.getMessage(), ex);
      event.handled().completeExceptionally(ex);
    } finally {
      MDC.remove("snapshot");
    }
  }

  private void processSnapshot(NetworkSnapshot snapshot) {
    Optional<NetworkSnapshot> previous = storeCall(store::getLatest);
    storeCall(() -> store.create(snapshot));
    snapshotsStored.increment();
    totalDevices = snapshot.deviceCount();
    metrics.increment("monitor.snapshot.stored");

    if (previous.isEmpty() || previous.get().id().equals(snapshot.id())) {
      devicesDiscovered.add(snapshot.deviceCount());
      log.info("Stored baseline snapshot {} with {} devices", snapshot.id(), snapshot.deviceCount());
      return;
    }
    SnapshotDiff diff = diffEngine.diff(previous.get(), snapshot);
    storeCall(() -> store.createDiff(diff));
    int total = diff.summary().totalChanges();
    changesDetected.add(total);
    devicesDiscovered.add(diff.summary().devicesAdded());
    metrics.observe("monitor.diff.totalChanges", total);
    log.info("Stored snapshot {} with {} devices; {} changes since {}",
        snapshot.id(), snapshot.deviceCount(), total, previous.get().id());

    int threshold = settings.significantChangeThreshold();
    if (total > threshold) {
      metrics.increment("monitor.change.significant");
      log.warn("Significant change: {} changes exceed threshold {}", total, threshold);
      notifySafely("significantChange", () -> notifications.significantChange(snapshot, diff, threshold));
    }
  }

  private void handleFailed(ScanEvent.Failed event) {
    totalScans.increment();
    scanErrors.increment();
    errorsEncountered.increment();
    metrics.increment("monitor.scan.failed");
    notifySafely("scanFailed",
        () -> notifications.scanFailed(event.jobId(), event.target(), event.attempts(), event.message()));
  }

  private void notifySafely(String signal, Runnable delivery) {
    try {
      delivery.run();
      metrics.increment("monitor.notify." + signal);
    } catch (RuntimeException ex) {
      metrics.increment("monitor.notify.failed");
      log.warn("Notification {} failed: {}", signal, ex.getMessage());
    }
  }

  private void teardown() {
    ScheduledExecutorService ticker = healthTicker;
    healthTicker = null;
    if (ticker != null) {
      ticker.shutdownNow();
    }

    String defaultJob = defaultScanJobId;
    defaultScanJobId = null;
    if (defaultJob != null) {
      try {
        scheduler.unschedule(defaultJob);
      } catch (NotFoundException ex) {
        log.debug("Default scan {} already removed", defaultJob);
      }
    }
    scheduler.stop();

    eventsRunning = false;
    ExecutorService events = eventThread;
    eventThread = null;
    if (events != null) {
      events.shutdown();
      try {
        if (!events.awaitTermination(settings.gracefulShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
          metrics.increment("monitor.shutdown.force");
          log.warn("Event thread still busy after {} ms; interrupting",
              settings.gracefulShutdownTimeout().toMillis());
          events.shutdownNow();
        }
      } catch (InterruptedException ie) {
        events.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    failUnhandledEvents();
    lastHealth = null;
    store.close();
  }

  private void failUnhandledEvents() {
    ScanEvent leftover;
    while ((leftover = scheduler.events().poll()) != null) {
      if (leftover instanceof ScanEvent.Completed completed) {
        completed.handled().completeExceptionally(
            new ServiceUnavailableException("monitor stopped before snapshot " + completed.snapshot().id()
                + " was stored"));
      }
      metrics.increment("monitor.event.dropped");
    }
  }

  private <T> T storeCall(Supplier<T> operation) {
    try {
      return storeRetry.execute(() -> storeBreaker.execute(operation));
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ServiceUnavailableException("interrupted while waiting for the snapshot store", ie);
    }
  }

  private void requireRunning() {
    OrchestratorState current = state.get();
    if (current != OrchestratorState.RUNNING) {
      throw new WrongStateException("orchestrator is " + current.name().toLowerCase());
    }
  }

  private void onUncaught(Thread thread, Throwable ex) {
    errorsEncountered.increment();
    metrics.increment("monitor.thread.uncaught");
    log.error("Uncaught exception on {}", thread.getName(), ex);
  }

  private static <T> T await(CompletableFuture<T> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new ScanException("manual scan failed", cause);
    }
  }
}
