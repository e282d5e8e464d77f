package ca.gc.cra.nmapper.application.monitoring;

import static ca.gc.cra.nmapper.testing.Fixtures.T0;
import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static ca.gc.cra.nmapper.testing.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nmapper.application.diff.SnapshotDiffEngine;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.application.resilience.Backoff;
import ca.gc.cra.nmapper.application.resilience.CircuitBreaker;
import ca.gc.cra.nmapper.application.scheduling.ScanJobScheduler;
import ca.gc.cra.nmapper.application.scheduling.SchedulerSettings;
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
import ca.gc.cra.nmapper.domain.snapshot.DiffSummary;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.testing.MutableClock;
import ca.gc.cra.nmapper.testing.OutageStore;
import ca.gc.cra.nmapper.testing.RecordingMetricsPort;
import ca.gc.cra.nmapper.testing.RecordingNotifications;
import ca.gc.cra.nmapper.testing.ScriptedScanner;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MonitoringOrchestratorTest {
  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private ScriptedScanner scanner;
  private OutageStore store;
  private RecordingNotifications notifications;
  private MonitoringOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    metrics = new RecordingMetricsPort();
    scanner = new ScriptedScanner();
    store = new OutageStore();
    notifications = new RecordingNotifications();
  }

  @AfterEach
  void tearDown() {
    if (orchestrator != null && orchestrator.state() != OrchestratorState.STOPPED) {
      orchestrator.stop();
    }
  }

  @Test
  void lifecycleTransitions() {
    orchestrator = newOrchestrator(settings(10));
    assertEquals(OrchestratorState.STOPPED, orchestrator.state());

    orchestrator.start();
    orchestrator.start();
    assertEquals(OrchestratorState.RUNNING, orchestrator.state());
    assertTrue(orchestrator.scheduler().isRunning());

    orchestrator.stop();
    orchestrator.stop();
    assertEquals(OrchestratorState.STOPPED, orchestrator.state());
    assertFalse(orchestrator.scheduler().isRunning());

    orchestrator.restart();
    assertEquals(OrchestratorState.RUNNING, orchestrator.state());
  }

  @Test
  void lifecycleCallsDuringStartupFailWithoutQueueing() throws Exception {
    CountDownLatch initialized = new CountDownLatch(1);
    store.holdInitializeUntil(initialized);
    orchestrator = newOrchestrator(settings(10));
    ExecutorService starter = Executors.newSingleThreadExecutor();
    try {
      Future<?> starting = starter.submit(() -> orchestrator.start());
      awaitCondition(() -> orchestrator.state() == OrchestratorState.STARTING);

      assertThrows(WrongStateException.class, () -> orchestrator.start());
      assertThrows(WrongStateException.class, () -> orchestrator.stop());
      assertThrows(WrongStateException.class, () -> orchestrator.restart());
      assertEquals(OrchestratorState.STARTING, orchestrator.state());

      initialized.countDown();
      starting.get(10, TimeUnit.SECONDS);
      assertEquals(OrchestratorState.RUNNING, orchestrator.state());
      assertEquals(1, store.initializeCalls());
      assertTrue(orchestrator.scheduler().isRunning());
    } finally {
      initialized.countDown();
      starter.shutdownNow();
    }
  }

  @Test
  void healthOfAStoppedMonitorLeavesTheStoreAlone() {
    orchestrator = newOrchestrator(settings(10));
    orchestrator.start();
    orchestrator.stop();
    int pingsAfterStop = store.pings();

    HealthStatus health = orchestrator.getHealth();

    assertEquals(HealthStatus.Level.UNHEALTHY, health.status());
    ComponentHealth storage = health.component(MonitoringOrchestrator.STORAGE).orElseThrow();
    assertFalse(storage.healthy());
    assertEquals("orchestrator stopped", storage.message());
    assertEquals(pingsAfterStop, store.pings());
  }

  @Test
  void manualScanRequiresRunningMonitor() {
    orchestrator = newOrchestrator(settings(10));

    assertThrows(WrongStateException.class,
        () -> orchestrator.triggerManualScan("10.0.0.0/24", ScanProfile.QUICK, null));
  }

  @Test
  void scansAreStoredDiffedAndReported() throws Exception {
    scanner.thenReturn(device("10.0.0.1", 22))
        .thenReturn(device("10.0.0.1", 22, 80), device("10.0.0.2"));
    orchestrator = newOrchestrator(settings(1));
    orchestrator.start();

    NetworkSnapshot baseline = orchestrator.triggerManualScan("10.0.0.0/24", ScanProfile.QUICK, null);
    assertTrue(orchestrator.getRecentChanges(1).isEmpty());
    assertEquals(baseline.id(), orchestrator.getLatestSnapshot().orElseThrow().id());

    clock.advance(Duration.ofMinutes(5));
    NetworkSnapshot next = orchestrator.triggerManualScan("10.0.0.0/24", ScanProfile.QUICK, null);

    List<SnapshotDiff> recent = orchestrator.getRecentChanges(1);
    assertEquals(1, recent.size());
    SnapshotDiff diff = recent.get(0);
    assertEquals(baseline.id(), diff.fromSnapshot());
    assertEquals(next.id(), diff.toSnapshot());
    assertEquals(new DiffSummary(1, 0, 1, 1, 0), diff.summary());

    assertEquals(1, notifications.significant().size());
    assertEquals(next.id(), notifications.significant().get(0).snapshotId());
    assertEquals(1, notifications.significant().get(0).threshold());

    MonitoringMetrics totals = orchestrator.getMetrics();
    assertEquals(2, totals.scansCompleted());
    assertEquals(2, totals.snapshotsStored());
    assertEquals(3, totals.changesDetected());
    assertEquals(2, totals.devicesDiscovered());
    assertEquals(2, totals.totalDevices());
    assertEquals(next.timestamp(), totals.lastScanTime());
    assertEquals(1, metrics.count("monitor.change.significant"));
  }

  @Test
  void changesAtOrBelowThresholdAreNotNotified() throws Exception {
    scanner.thenReturn(device("10.0.0.1", 22)).thenReturn(device("10.0.0.1", 22, 80));
    orchestrator = newOrchestrator(settings(2));
    orchestrator.start();

    orchestrator.triggerManualScan("10.0.0.1", null, null);
    orchestrator.triggerManualScan("10.0.0.1", null, null);

    assertEquals(2, orchestrator.getRecentChanges(1).get(0).summary().totalChanges());
    assertTrue(notifications.significant().isEmpty());
  }

  @Test
  void failedScansAreCountedAndNotified() throws Exception {
    scanner.thenThrow(new ScanException("scanner exited with code 1"));
    orchestrator = newOrchestrator(settings(10));
    orchestrator.start();

    assertThrows(ScanException.class, () -> orchestrator.triggerManualScan("10.0.0.7", null, null));

    awaitCondition(() -> notifications.failures().size() == 1);
    RecordingNotifications.Failure failure = notifications.failures().get(0);
    assertEquals("10.0.0.7", failure.target());
    assertEquals(1, failure.attempts());
    awaitCondition(() -> orchestrator.getMetrics().scanErrors() == 1);
    assertEquals(1, orchestrator.getMetrics().totalScans());
    assertEquals(OrchestratorState.RUNNING, orchestrator.state());
  }

  @Test
  void comparingASnapshotWithItselfStoresNothing() {
    orchestrator = newOrchestrator(settings(10));
    NetworkSnapshot s = snapshot("s1", device("10.0.0.1", 22));
    store.create(s);

    SnapshotDiff diff = orchestrator.compareSnapshots("s1", "s1");

    assertTrue(diff.hasNoChanges());
    assertEquals(0, store.delegate().diffCount());
  }

  @Test
  void comparingTwoSnapshotsStoresTheDiffOnce() {
    orchestrator = newOrchestrator(settings(10));
    store.create(snapshot("s1", device("10.0.0.1")));
    store.create(snapshot("s2", T0.plusSeconds(60), device("10.0.0.1"), device("10.0.0.2")));

    SnapshotDiff first = orchestrator.compareSnapshots("s1", "s2");
    SnapshotDiff second = orchestrator.compareSnapshots("s1", "s2");

    assertEquals(first, second);
    assertEquals(1, first.summary().devicesAdded());
    assertEquals(1, store.delegate().diffCount());
  }

  @Test
  void unknownSnapshotsAreNotFound() {
    orchestrator = newOrchestrator(settings(10));
    store.create(snapshot("s1", device("10.0.0.1")));

    assertThrows(NotFoundException.class, () -> orchestrator.compareSnapshots("s1", "missing"));
    assertThrows(NotFoundException.class, () -> orchestrator.getSnapshot("missing"));
    assertThrows(ValidationException.class, () -> orchestrator.compareSnapshots(null, "s1"));
  }

  @Test
  void recentChangeWindowIsBounded() {
    orchestrator = newOrchestrator(settings(10));

    assertThrows(ValidationException.class, () -> orchestrator.getRecentChanges(0));
    assertThrows(ValidationException.class,
        () -> orchestrator.getRecentChanges(MonitoringOrchestrator.MAX_RECENT_HOURS + 1));
    assertTrue(orchestrator.getRecentChanges(MonitoringOrchestrator.MAX_RECENT_HOURS).isEmpty());
  }

  @Test
  void listsSnapshotsNewestFirstByDefault() {
    orchestrator = newOrchestrator(settings(10));
    store.create(snapshot("old", T0.minusSeconds(600), device("10.0.0.1")));
    store.create(snapshot("new", T0, device("10.0.0.1"), device("10.0.0.2")));

    assertEquals(List.of("new", "old"), orchestrator.listSnapshots(null, null).items().stream()
        .map(NetworkSnapshot::id).toList());
    SnapshotQuery bySize = new SnapshotQuery(null, null, "10.0.0.2", SnapshotQuery.SortField.DEVICE_COUNT, true);
    assertEquals(1, orchestrator.listSnapshots(bySize, new PageRequest(1, 5)).total());
  }

  @Test
  void transientStoreFailuresAreRetried() {
    orchestrator = newOrchestrator(settings(10));
    store.create(snapshot("s1", device("10.0.0.1")));
    store.failNext(1);

    assertEquals("s1", orchestrator.getLatestSnapshot().orElseThrow().id());
    assertEquals(1, metrics.count("retry.store.failure"));
  }

  @Test
  void storageOutageOpensBreakerAndDegradesHealth() {
    orchestrator = newOrchestrator(settings(10));
    store.down(true);

    assertThrows(ServiceUnavailableException.class, () -> orchestrator.getLatestSnapshot());
    assertThrows(ServiceUnavailableException.class, () -> orchestrator.getLatestSnapshot());
    assertEquals(CircuitBreaker.State.OPEN, orchestrator.storeBreaker().state());
    int callsWhenOpened = store.calls();

    assertThrows(ServiceUnavailableException.class, () -> orchestrator.getSnapshot("s1"));
    assertEquals(callsWhenOpened, store.calls());

    HealthStatus health = orchestrator.checkHealth();
    assertEquals(HealthStatus.Level.DEGRADED, health.status());
    assertFalse(health.component(MonitoringOrchestrator.STORAGE).orElseThrow().healthy());
    assertFalse(health.component(MonitoringOrchestrator.SNAPSHOTS).orElseThrow().healthy());
    assertTrue(health.component(MonitoringOrchestrator.SCANNER).orElseThrow().healthy());

    store.down(false);
    clock.advance(Duration.ofSeconds(60));
    assertTrue(orchestrator.getLatestSnapshot().isEmpty());
    assertEquals(CircuitBreaker.State.CLOSED, orchestrator.storeBreaker().state());
  }

  @Test
  void startFailureLeavesErrorStateUntilRestart() {
    orchestrator = newOrchestrator(settings(10));
    store.down(true);

    assertThrows(ServiceUnavailableException.class, () -> orchestrator.start());
    assertEquals(OrchestratorState.ERROR, orchestrator.state());
    assertThrows(WrongStateException.class, () -> orchestrator.start());

    store.down(false);
    clock.advance(Duration.ofSeconds(60));
    orchestrator.restart();
    assertEquals(OrchestratorState.RUNNING, orchestrator.state());
  }

  @Test
  void healthReflectsScannerAndSnapshotAge() {
    MonitorSettings withDefault = settings(10).withDefaultScan(
        new MonitorSettings.DefaultScan("10.0.0.0/24", Duration.ofMinutes(5), ScanProfile.QUICK));
    orchestrator = newOrchestrator(withDefault);
    store.create(snapshot("s1", T0, device("10.0.0.1")));

    assertEquals(HealthStatus.Level.HEALTHY, orchestrator.checkHealth().status());

    clock.advance(Duration.ofMinutes(16));
    scanner.available(false);
    HealthStatus health = orchestrator.checkHealth();
    assertEquals(HealthStatus.Level.DEGRADED, health.status());
    ComponentHealth snapshots = health.component(MonitoringOrchestrator.SNAPSHOTS).orElseThrow();
    assertFalse(snapshots.healthy());
    assertTrue(snapshots.message().contains("16 minutes old"));
    assertFalse(health.component(MonitoringOrchestrator.SCANNER).orElseThrow().healthy());
  }

  @Test
  void defaultScanIsScheduledWhileRunning() throws Exception {
    scanner.thenReturn(device("10.0.0.1"));
    MonitorSettings withDefault = settings(10).withDefaultScan(
        new MonitorSettings.DefaultScan("10.0.0.0/24", Duration.ofMinutes(5), ScanProfile.QUICK));
    orchestrator = newOrchestrator(withDefault);

    orchestrator.start();
    awaitCondition(() -> store.delegate().getLatest().isPresent());
    assertEquals(1, orchestrator.getMetrics().activeSchedules());
    assertEquals("quick", store.delegate().getLatest().orElseThrow().metadata().scanType());

    orchestrator.stop();
    assertTrue(orchestrator.scheduler().listSchedules().isEmpty());
  }

  @Test
  void retentionSweepRemovesOldSnapshots() {
    orchestrator = newOrchestrator(settings(10));
    store.create(snapshot("ancient", T0.minus(Duration.ofDays(45)), device("10.0.0.1")));
    store.create(snapshot("recent", T0.minus(Duration.ofDays(1)), device("10.0.0.1")));

    assertEquals(1, orchestrator.sweepRetention());
    assertThrows(NotFoundException.class, () -> orchestrator.getSnapshot("ancient"));
    assertEquals("recent", orchestrator.getSnapshot("recent").id());
  }

  @Test
  void uptimeFollowsTheClock() {
    orchestrator = newOrchestrator(settings(10));
    assertEquals(0L, orchestrator.getMetrics().uptimeMillis());

    orchestrator.start();
    clock.advance(Duration.ofSeconds(5));

    assertEquals(5_000L, orchestrator.getMetrics().uptimeMillis());
  }

  private MonitoringOrchestrator newOrchestrator(MonitorSettings settings) {
    SchedulerSettings schedulerSettings = new SchedulerSettings(2, 0, Backoff.doubling(Duration.ZERO, Duration.ZERO),
        Duration.ofSeconds(1), Duration.ofDays(1), Duration.ofSeconds(30), Duration.ofSeconds(2), 50);
    ScanJobScheduler scheduler = new ScanJobScheduler(scanner, schedulerSettings, clock, metrics);
    return new MonitoringOrchestrator(scheduler, scanner, store, new SnapshotDiffEngine(), notifications, settings,
        clock, metrics, duration -> { });
  }

  private static MonitorSettings settings(int threshold) {
    return new MonitorSettings(Duration.ofHours(1), Duration.ofSeconds(5), threshold, Duration.ofDays(30), null, 2,
        Backoff.doubling(Duration.ZERO, Duration.ZERO), 3, Duration.ofSeconds(60));
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 10 s");
      }
      Thread.sleep(10L);
    }
  }
}
