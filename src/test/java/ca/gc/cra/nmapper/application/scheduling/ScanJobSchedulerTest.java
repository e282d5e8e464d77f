package ca.gc.cra.nmapper.application.scheduling;

import static ca.gc.cra.nmapper.testing.Fixtures.T0;
import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nmapper.application.port.ScannerPort;
import ca.gc.cra.nmapper.application.resilience.Backoff;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.error.WrongStateException;
import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.testing.MutableClock;
import ca.gc.cra.nmapper.testing.RecordingMetricsPort;
import ca.gc.cra.nmapper.testing.ScriptedScanner;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScanJobSchedulerTest {
  private static final long WAIT_SECONDS = 10L;

  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private ScriptedScanner scanner;
  private ScanJobScheduler scheduler;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    metrics = new RecordingMetricsPort();
    scanner = new ScriptedScanner();
  }

  @AfterEach
  void tearDown() {
    if (scheduler != null) {
      scheduler.stop();
    }
  }

  @Test
  void manualScanProducesSnapshotAndEvent() throws Exception {
    scanner.thenReturn(device("10.0.0.1", 22), device("10.0.0.2"));
    scheduler = newScheduler(settings(2, 0, Duration.ofSeconds(5)));
    scheduler.start();

    NetworkSnapshot snapshot = scheduler.triggerManual("10.0.0.0/24", ScanProfile.QUICK, null);

    assertEquals(2, snapshot.deviceCount());
    assertEquals("quick", snapshot.metadata().scanType());
    assertEquals("10.0.0.0/24", snapshot.metadata().scanTarget());
    ScanEvent event = scheduler.events().poll(WAIT_SECONDS, TimeUnit.SECONDS);
    ScanEvent.Completed completed = assertInstanceOf(ScanEvent.Completed.class, event);
    assertEquals(RunKind.MANUAL, completed.kind());
    assertEquals(snapshot.id(), completed.snapshot().id());
    assertEquals(1, scheduler.metrics().completedRuns());
  }

  @Test
  void neverRunsMoreScansThanTheCeiling() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    scanner.holdUntil(gate).thenReturn(device("10.0.0.1"));
    scheduler = newScheduler(settings(2, 0, Duration.ofSeconds(5)));
    scheduler.start();

    List<CompletableFuture<ScanEvent.Completed>> futures = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      futures.add(scheduler.submitManual("10.0.0." + (i + 1), ScanProfile.QUICK, null));
    }
    awaitCondition(() -> scanner.inFlight() == 2);
    Thread.sleep(200L);

    assertEquals(2, scanner.inFlight());
    assertEquals(2, scheduler.metrics().runningScans());
    assertEquals(3, scheduler.metrics().queuedJobs());

    gate.countDown();
    for (CompletableFuture<ScanEvent.Completed> future : futures) {
      assertNotNull(future.get(WAIT_SECONDS, TimeUnit.SECONDS).snapshot());
    }
    assertEquals(5, scanner.calls());
    assertEquals(2, scanner.maxInFlight());
  }

  @Test
  void permanentlyFailingScanIsAttemptedMaxRetriesPlusOneTimes() throws Exception {
    scanner.thenThrow(new ScanException("host unreachable"));
    scheduler = newScheduler(settings(1, 2, Duration.ofSeconds(5)));
    scheduler.start();

    CompletableFuture<ScanEvent.Completed> future = scheduler.submitManual("10.0.0.9", null, null);

    ExecutionException ex = assertThrows(ExecutionException.class,
        () -> future.get(WAIT_SECONDS, TimeUnit.SECONDS));
    assertInstanceOf(ScanException.class, ex.getCause());
    assertEquals(3, scanner.calls());
    ScanEvent.Failed failed = assertInstanceOf(ScanEvent.Failed.class,
        scheduler.events().poll(WAIT_SECONDS, TimeUnit.SECONDS));
    assertEquals(3, failed.attempts());
    assertEquals("host unreachable", failed.message());
    assertNull(scheduler.events().poll(300, TimeUnit.MILLISECONDS));
    assertEquals(3, scanner.calls());
    assertEquals(2, metrics.count("scheduler.scan.retry"));

    ScanExecution execution = scheduler.history().get(0);
    assertEquals(ScanExecution.Status.FAILED, execution.status());
    assertEquals(3, execution.attempts());
  }

  @Test
  void retriedScanRecordsEarlierErrorsInMetadata() throws Exception {
    scanner.thenThrow(new ScanException("timed out")).thenReturn(device("10.0.0.1"));
    scheduler = newScheduler(settings(1, 2, Duration.ofSeconds(5)));
    scheduler.start();

    NetworkSnapshot snapshot = scheduler.triggerManual("10.0.0.1", ScanProfile.DISCOVERY, Duration.ofSeconds(10));

    assertEquals(List.of("attempt 1: timed out"), snapshot.metadata().errors());
    assertEquals(2, scanner.calls());
  }

  @Test
  void nonRetryableFailureIsNotRetried() throws Exception {
    scanner.thenThrow(new ScanException("scanner command could not be started", null, false));
    scheduler = newScheduler(settings(1, 3, Duration.ofSeconds(5)));
    scheduler.start();

    assertThrows(ScanException.class, () -> scheduler.triggerManual("10.0.0.1", null, null));
    assertEquals(1, scanner.calls());
  }

  @Test
  void recurringScheduleKeepsRunningAfterAFailure() throws Exception {
    scanner.thenThrow(new ScanException("boom")).thenReturn(device("10.0.0.1"));
    scheduler = newScheduler(settings(1, 0, Duration.ofSeconds(5)));
    String id = scheduler.schedule("10.0.0.0/30", Duration.ofMinutes(1), ScanProfile.QUICK);
    scheduler.start();

    ScanEvent first = scheduler.events().poll(WAIT_SECONDS, TimeUnit.SECONDS);
    assertInstanceOf(ScanEvent.Failed.class, first);
    assertEquals(T0.plus(Duration.ofMinutes(1)), scheduler.getSchedule(id).nextRun());

    clock.advance(Duration.ofMinutes(1));
    ScanEvent second = scheduler.events().poll(WAIT_SECONDS, TimeUnit.SECONDS);
    ScanEvent.Completed completed = assertInstanceOf(ScanEvent.Completed.class, second);
    assertEquals(RunKind.RECURRING, completed.kind());

    ScheduledScan view = scheduler.getSchedule(id);
    assertEquals(2, view.runCount());
    assertEquals(1, view.failureCount());
    assertNull(view.lastError());
    assertTrue(view.enabled());
  }

  @Test
  void disabledScheduleDoesNotRun() throws Exception {
    scheduler = newScheduler(settings(1, 0, Duration.ofSeconds(5)));
    String id = scheduler.schedule("nightly", "10.0.0.0/24", Duration.ofMinutes(5), ScanProfile.DISCOVERY, false);
    scheduler.start();

    assertNull(scheduler.events().poll(300, TimeUnit.MILLISECONDS));
    assertEquals(0, scanner.calls());
    assertEquals(0, scheduler.metrics().activeSchedules());
    assertEquals("nightly", scheduler.getSchedule(id).name());

    scheduler.enable(id);
    assertNotNull(scheduler.events().poll(WAIT_SECONDS, TimeUnit.SECONDS));
    assertEquals(1, scheduler.metrics().activeSchedules());
  }

  @Test
  void runNowQueuesOneExtraRunOfADisabledSchedule() throws Exception {
    scheduler = newScheduler(settings(1, 0, Duration.ofSeconds(5)));
    String id = scheduler.schedule("lab", "10.0.0.0/24", Duration.ofMinutes(5), ScanProfile.QUICK, false);
    scheduler.start();

    scheduler.runNow(id);

    ScanEvent.Completed completed = assertInstanceOf(ScanEvent.Completed.class,
        scheduler.events().poll(WAIT_SECONDS, TimeUnit.SECONDS));
    assertEquals(RunKind.ON_DEMAND, completed.kind());
    assertNull(scheduler.events().poll(200, TimeUnit.MILLISECONDS));
    assertFalse(scheduler.getSchedule(id).enabled());
    assertEquals(1, scanner.calls());
  }

  @Test
  void rejectsInvalidRequests() {
    scheduler = newScheduler(settings(1, 0, Duration.ofSeconds(5)));

    assertThrows(ValidationException.class,
        () -> scheduler.schedule("10.0.0.0/24", Duration.ofMillis(1), ScanProfile.QUICK));
    assertThrows(ValidationException.class,
        () -> scheduler.schedule("10.0.0.0/24", Duration.ofDays(2), ScanProfile.QUICK));
    assertThrows(ValidationException.class,
        () -> scheduler.schedule("10.0.0.0/99", Duration.ofMinutes(5), ScanProfile.QUICK));
    assertThrows(WrongStateException.class, () -> scheduler.submitManual("10.0.0.1", null, null));
    assertThrows(NotFoundException.class, () -> scheduler.runNow("missing"));

    scheduler.start();
    assertThrows(ValidationException.class,
        () -> scheduler.submitManual("10.0.0.1", null, Duration.ofSeconds(1)));
    assertThrows(ValidationException.class,
        () -> scheduler.submitManual("10.0.0.1", null, Duration.ofMinutes(6)));
  }

  @Test
  void stopFailsQueuedAndInFlightManualScans() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    scanner.holdUntil(gate);
    scheduler = newScheduler(settings(1, 0, Duration.ofMillis(200)));
    scheduler.start();

    CompletableFuture<ScanEvent.Completed> running = scheduler.submitManual("10.0.0.1", null, null);
    CompletableFuture<ScanEvent.Completed> queued = scheduler.submitManual("10.0.0.2", null, null);
    awaitCondition(() -> scanner.inFlight() == 1);

    scheduler.stop();

    assertFalse(scheduler.isRunning());
    ExecutionException first = assertThrows(ExecutionException.class,
        () -> running.get(WAIT_SECONDS, TimeUnit.SECONDS));
    assertInstanceOf(ScanException.class, first.getCause());
    ExecutionException second = assertThrows(ExecutionException.class,
        () -> queued.get(WAIT_SECONDS, TimeUnit.SECONDS));
    assertTrue(second.getCause().getMessage().contains("scheduler stopped"));
    assertEquals(1, scanner.calls());
  }

  @Test
  void stopFailsManualScanWhoseScannerOutlivesTheGracePeriod() throws Exception {
    StubbornScanner stubborn = new StubbornScanner(Duration.ofMillis(1500));
    scheduler = new ScanJobScheduler(stubborn, settings(1, 0, Duration.ofMillis(100)), clock, metrics);
    scheduler.start();

    CompletableFuture<ScanEvent.Completed> pending = scheduler.submitManual("10.0.0.1", null, null);
    assertTrue(stubborn.started.await(WAIT_SECONDS, TimeUnit.SECONDS));

    scheduler.stop();

    ExecutionException failure = assertThrows(ExecutionException.class,
        () -> pending.get(1, TimeUnit.SECONDS));
    ScanException cause = assertInstanceOf(ScanException.class, failure.getCause());
    assertTrue(cause.getMessage().contains("abandoned"));
    awaitCondition(() -> metrics.count("scheduler.scan.discarded") == 1);
    assertTrue(scheduler.events().isEmpty());
  }

  @Test
  void unscheduleRemovesJob() {
    scheduler = newScheduler(settings(1, 0, Duration.ofSeconds(5)));
    String id = scheduler.schedule("10.0.0.0/24", Duration.ofMinutes(5), null);

    assertEquals(ScanProfile.DISCOVERY, scheduler.getSchedule(id).profile());
    scheduler.unschedule(id);

    assertTrue(scheduler.listSchedules().isEmpty());
    assertThrows(NotFoundException.class, () -> scheduler.getSchedule(id));
  }

  private ScanJobScheduler newScheduler(SchedulerSettings settings) {
    return new ScanJobScheduler(scanner, settings, clock, metrics);
  }

  private static SchedulerSettings settings(int concurrency, int retries, Duration grace) {
    return new SchedulerSettings(concurrency, retries, Backoff.doubling(Duration.ZERO, Duration.ZERO),
        Duration.ofSeconds(1), Duration.ofDays(1), Duration.ofSeconds(30), grace, 50);
  }

  /** Keeps scanning through interrupts until its fixed duration has passed. */
  private static final class StubbornScanner implements ScannerPort {
    private final Duration duration;
    private final CountDownLatch started = new CountDownLatch(1);

    StubbornScanner(Duration duration) {
      this.duration = duration;
    }

    @Override
    public List<Device> scan(ScanTarget target, ScanProfile profile, Duration timeout) {
      started.countDown();
      long deadline = System.nanoTime() + duration.toNanos();
      long remaining;
      while ((remaining = deadline - System.nanoTime()) > 0) {
        try {
          TimeUnit.NANOSECONDS.sleep(remaining);
        } catch (InterruptedException ignored) {
          // keeps going, like a scanner that never checks its interrupt flag
        }
      }
      return List.of(device("10.0.0.1"));
    }

    @Override
    public boolean available() {
      return true;
    }

    @Override
    public String describe() {
      return "stubborn";
    }
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within " + WAIT_SECONDS + " s");
      }
      Thread.sleep(10L);
    }
  }
}
