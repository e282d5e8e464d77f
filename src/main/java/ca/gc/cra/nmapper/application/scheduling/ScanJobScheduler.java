package ca.gc.cra.nmapper.application.scheduling;

import ca.gc.cra.nmapper.application.port.ClockPort;
import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.ScannerPort;
import ca.gc.cra.nmapper.domain.error.NmapperException;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.error.WrongStateException;
import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotMetadata;
import ca.gc.cra.nmapper.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.nmapper.validation.Strings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs recurring and manual network scans with bounded concurrency and retries.
 * <p><strong>Why:</strong> Decouples when scans happen from what is done with their results; completed scans are
 * published as {@link ScanEvent}s on {@link #events()} for the orchestrator to persist and diff.</p>
 * <p><strong>Model:</strong>
 * <ul>
 *   <li>A single dispatch thread takes runs from a due-time ordered queue and hands them to a fixed worker
 *   pool.</li>
 *   <li>A counting semaphore caps running scans at {@code maxConcurrentScans}; excess runs wait in the queue.</li>
 *   <li>Retryable failures are requeued after a capped doubling backoff; a scan is attempted at most
 *   {@code maxRetries + 1} times per invocation.</li>
 *   <li>A recurring job schedules its next occurrence when an invocation finishes, whether it succeeded or
 *   failed, so one job never overlaps itself.</li>
 * </ul>
 * <p><strong>Shutdown:</strong> {@link #stop()} waits {@code shutdownGrace} for running scans, then interrupts
 * them; results arriving after that are discarded.</p>
 * <p><strong>Thread-safety:</strong> All public methods are safe to call from any thread.</p>
 * <p><strong>Observability:</strong> {@code scheduler.scan.*} counters, {@code scheduler.scan.durationMillis},
 * {@code scheduler.scan.running} and {@code scheduler.queue.depth} gauges; MDC key {@code scanJob} on worker
 * threads.</p>
 *
 * @since 0.1.0
 */
public final class ScanJobScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScanJobScheduler.class);

  /** Longest error text kept on a job or execution. */
  public static final int MAX_ERROR_LENGTH = 1000;

  private static final long MAX_IDLE_WAIT_MILLIS = 1_000L;

  private final ScannerPort scanner;
  private final SchedulerSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final BlockingQueue<ScanEvent> events = new LinkedBlockingQueue<>();

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition wakeup = lock.newCondition();
  private final PriorityQueue<PendingRun> queue = new PriorityQueue<>(PendingRun.ORDER);
  private final Map<String, JobState> jobs = new LinkedHashMap<>();
  private final Deque<ScanExecution> history = new ArrayDeque<>();
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicInteger runningScans = new AtomicInteger();
  private final Set<PendingRun> inFlight = ConcurrentHashMap.newKeySet();

  // guarded by lock
  private boolean running;
  private long epoch;
  private long completedRuns;
  private long failedRuns;
  private long completedDurationMillis;
  private Instant lastCompletedRun;
  private Semaphore permits;
  private ExecutorService dispatcher;
  private ExecutorService workers;

  /**
   * Creates a stopped scheduler.
   *
   * @param scanner scanner used for every run
   * @param settings scheduler tuning
   * @param clock time source for due times and timestamps
   * @param metrics metrics sink
   */
  public ScanJobScheduler(
      ScannerPort scanner, SchedulerSettings settings, ClockPort clock, MetricsPort metrics) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Event channel carrying completed and failed scans in completion order.
   *
   * @return channel consumed by a single reader
   */
  public BlockingQueue<ScanEvent> events() {
    return events;
  }

  /**
   * Registers an enabled recurring scan named after its range.
   *
   * @param range IP address, CIDR block or address range
   * @param interval recurrence interval
   * @param profile scan profile
   * @return job id
   * @throws ValidationException if the range or interval is invalid
   */
  public String schedule(String range, Duration interval, ScanProfile profile) {
    return schedule(null, range, interval, profile, true);
  }

  /**
   * Registers a recurring scan. An enabled job runs for the first time as soon as a slot is free.
   *
   * @param name display name; defaults to {@code "scan <range>"} when blank
   * @param range IP address, CIDR block or address range
   * @param interval recurrence interval between {@code minInterval} and {@code maxInterval}
   * @param profile scan profile; defaults to discovery
   * @param enabled whether periodic runs are dispatched
   * @return job id
   * @throws ValidationException if the range or interval is invalid
   */
  public String schedule(String name, String range, Duration interval, ScanProfile profile, boolean enabled) {
    ScanTarget target = ScanTarget.parse(range);
    validateInterval(interval);
    ScanProfile effectiveProfile = profile == null ? ScanProfile.DISCOVERY : profile;
    String displayName = (name == null || name.isBlank()) ? "scan " + target.value() : name.trim();
    String id = UUID.randomUUID().toString();
    Instant now = clock.now();
    lock.lock();
    try {
      JobState job =
          new JobState(id, displayName, target, effectiveProfile, interval, settings.defaultTimeout(), now);
      job.enabled = enabled;
      jobs.put(id, job);
      if (enabled && running) {
        startChain(job, now.toEpochMilli());
      }
    } finally {
      lock.unlock();
    }
    metrics.increment("scheduler.schedule.created");
    log.info("Scheduled scan {} ({}) of {} every {} s with profile {}{}",
        id, displayName, target, interval.toSeconds(), effectiveProfile.label(), enabled ? "" : " (disabled)");
    return id;
  }

  /**
   * Enables periodic runs of a job; the next run is due immediately. No-op when already enabled.
   *
   * @param jobId job id
   * @throws NotFoundException if the job does not exist
   */
  public void enable(String jobId) {
    lock.lock();
    try {
      JobState job = requireJob(jobId);
      if (job.enabled) {
        return;
      }
      job.enabled = true;
      job.updatedAt = clock.now();
      if (running) {
        startChain(job, clock.nowMillis());
      }
    } finally {
      lock.unlock();
    }
    log.info("Enabled scan {}", jobId);
  }

  /**
   * Disables periodic runs of a job. A run already in progress completes normally.
   *
   * @param jobId job id
   * @throws NotFoundException if the job does not exist
   */
  public void disable(String jobId) {
    lock.lock();
    try {
      JobState job = requireJob(jobId);
      if (!job.enabled) {
        return;
      }
      job.enabled = false;
      job.chainToken++;
      job.nextRun = null;
      job.updatedAt = clock.now();
      queue.removeIf(run -> run.jobId().equals(jobId) && run.kind() == RunKind.RECURRING);
    } finally {
      lock.unlock();
    }
    log.info("Disabled scan {}", jobId);
  }

  /**
   * Removes a job and any of its queued runs.
   *
   * @param jobId job id
   * @throws NotFoundException if the job does not exist
   */
  public void unschedule(String jobId) {
    lock.lock();
    try {
      requireJob(jobId);
      jobs.remove(jobId);
      queue.removeIf(run -> run.jobId().equals(jobId));
    } finally {
      lock.unlock();
    }
    metrics.increment("scheduler.schedule.removed");
    log.info("Unscheduled scan {}", jobId);
  }

  /**
   * Queues an extra run of a registered job, whether or not it is enabled. Its periodic timing is unaffected.
   *
   * @param jobId job id
   * @throws NotFoundException if the job does not exist
   * @throws WrongStateException if the scheduler is not running
   */
  public void runNow(String jobId) {
    lock.lock();
    try {
      JobState job = requireJob(jobId);
      requireRunning();
      enqueue(PendingRun.first(job.id, RunKind.ON_DEMAND, job.target, job.profile, job.timeout,
          clock.nowMillis(), sequence.incrementAndGet(), job.chainToken, null));
    } finally {
      lock.unlock();
    }
    log.info("Queued on-demand run of scan {}", jobId);
  }

  /**
   * Runs an ad hoc scan and waits for its snapshot. The scan waits for a free slot like any other run.
   *
   * @param range IP address, CIDR block or address range
   * @param profile scan profile; defaults to discovery
   * @param timeout scan timeout; {@code null} uses the configured default
   * @return snapshot built from the scan result (not yet persisted)
   * @throws ValidationException if the range or timeout is invalid
   * @throws ScanException if every attempt fails
   * @throws WrongStateException if the scheduler is not running
   * @throws InterruptedException if interrupted while waiting
   */
  public NetworkSnapshot triggerManual(String range, ScanProfile profile, Duration timeout)
      throws InterruptedException {
    CompletableFuture<ScanEvent.Completed> future = submitManual(range, profile, timeout);
    try {
      return future.get().snapshot();
    } catch (ExecutionException ex) {
      throw unwrap(ex);
    }
  }

  /**
   * Queues an ad hoc scan without waiting.
   *
   * @param range IP address, CIDR block or address range
   * @param profile scan profile; defaults to discovery
   * @param timeout scan timeout; {@code null} uses the configured default
   * @return future completed with the published event, or exceptionally with a {@link ScanException}
   * @throws ValidationException if the range or timeout is invalid
   * @throws WrongStateException if the scheduler is not running
   */
  public CompletableFuture<ScanEvent.Completed> submitManual(String range, ScanProfile profile, Duration timeout) {
    ScanTarget target = ScanTarget.parse(range);
    Duration effectiveTimeout = validateTimeout(timeout);
    ScanProfile effectiveProfile = profile == null ? ScanProfile.DISCOVERY : profile;
    CompletableFuture<ScanEvent.Completed> future = new CompletableFuture<>();
    String id = "manual-" + UUID.randomUUID();
    lock.lock();
    try {
      requireRunning();
      enqueue(PendingRun.first(id, RunKind.MANUAL, target, effectiveProfile, effectiveTimeout,
          clock.nowMillis(), sequence.incrementAndGet(), 0L, future));
    } finally {
      lock.unlock();
    }
    metrics.increment("scheduler.manual.requested");
    log.info("Queued manual scan {} of {} with profile {}", id, target, effectiveProfile.label());
    return future;
  }

  /**
   * Registered jobs in registration order.
   *
   * @return immutable list of job views
   */
  public List<ScheduledScan> listSchedules() {
    lock.lock();
    try {
      List<ScheduledScan> views = new ArrayList<>(jobs.size());
      for (JobState job : jobs.values()) {
        views.add(job.view());
      }
      return List.copyOf(views);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Looks up one job.
   *
   * @param jobId job id
   * @return job view
   * @throws NotFoundException if the job does not exist
   */
  public ScheduledScan getSchedule(String jobId) {
    lock.lock();
    try {
      return requireJob(jobId).view();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Most recent executions, oldest first, bounded by {@code historyLimit}.
   *
   * @return immutable history
   */
  public List<ScanExecution> history() {
    lock.lock();
    try {
      return List.copyOf(history);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Current scheduler counters.
   *
   * @return metrics snapshot
   */
  public SchedulerMetrics metrics() {
    lock.lock();
    try {
      int active = 0;
      Instant next = null;
      for (JobState job : jobs.values()) {
        if (job.enabled) {
          active++;
          if (job.nextRun != null && (next == null || job.nextRun.isBefore(next))) {
            next = job.nextRun;
          }
        }
      }
      long average = completedRuns == 0 ? 0L : completedDurationMillis / completedRuns;
      return new SchedulerMetrics(jobs.size(), active, completedRuns, failedRuns, average, next,
          lastCompletedRun, runningScans.get(), queue.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports whether dispatch is active.
   *
   * @return {@code true} between {@link #start()} and {@link #stop()}
   */
  public boolean isRunning() {
    lock.lock();
    try {
      return running;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Settings in effect.
   *
   * @return scheduler settings
   */
  public SchedulerSettings settings() {
    return settings;
  }

  /**
   * Starts dispatch; enabled jobs become due immediately. Idempotent.
   */
  public void start() {
    ExecutorService loop;
    Semaphore slots;
    lock.lock();
    try {
      if (running) {
        return;
      }
      running = true;
      permits = new Semaphore(settings.maxConcurrentScans());
      workers = ExecutorFactories.newWorkerPool(
          settings.maxConcurrentScans(), "nmapper-scan", this::onUncaught);
      dispatcher = ExecutorFactories.newSingleThread("nmapper-scan-dispatch", this::onUncaught);
      queue.clear();
      long now = clock.nowMillis();
      for (JobState job : jobs.values()) {
        if (job.enabled) {
          startChain(job, now);
        }
      }
      loop = dispatcher;
      slots = permits;
    } finally {
      lock.unlock();
    }
    long currentEpoch = currentEpoch();
    loop.execute(() -> dispatchLoop(slots, currentEpoch));
    log.info("Scan scheduler started with {} slots and {} retries", settings.maxConcurrentScans(),
        settings.maxRetries());
  }

  /**
   * Stops dispatch, waits up to {@code shutdownGrace} for running scans, then interrupts them. Queued runs are
   * dropped and pending manual requests fail. Idempotent.
   */
  public void stop() {
    ExecutorService loop;
    ExecutorService pool;
    List<PendingRun> dropped;
    lock.lock();
    try {
      if (!running) {
        return;
      }
      running = false;
      dropped = new ArrayList<>(queue);
      queue.clear();
      for (JobState job : jobs.values()) {
        job.nextRun = null;
      }
      wakeup.signalAll();
      loop = dispatcher;
      pool = workers;
      dispatcher = null;
      workers = null;
    } finally {
      lock.unlock();
    }
    log.info("Stopping scan scheduler; {} queued runs dropped", dropped.size());
    for (PendingRun run : dropped) {
      abandon(run);
    }

    loop.shutdownNow();
    pool.shutdown();
    long graceMillis = settings.shutdownGrace().toMillis();
    boolean terminated = false;
    try {
      loop.awaitTermination(graceMillis, TimeUnit.MILLISECONDS);
      terminated = pool.awaitTermination(graceMillis, TimeUnit.MILLISECONDS);
      if (!terminated) {
        abandonInFlight();
        metrics.increment("scheduler.shutdown.force");
        log.warn("Scans still running after {} ms; cancelling them", graceMillis);
        pool.shutdownNow();
        terminated = pool.awaitTermination(graceMillis, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      abandonInFlight();
      pool.shutdownNow();
      metrics.increment("scheduler.shutdown.interrupted");
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Scan workers failed to terminate cleanly; late results will be discarded");
    }
    lock.lock();
    try {
      epoch++;
    } finally {
      lock.unlock();
    }
    log.info("Scan scheduler stopped");
  }

  @Override
  public void close() {
    stop();
  }

  private void abandonInFlight() {
    lock.lock();
    try {
      epoch++;
    } finally {
      lock.unlock();
    }
    for (PendingRun run : inFlight) {
      failAbandoned(run);
    }
  }

  private static void failAbandoned(PendingRun run) {
    if (run.future() != null) {
      run.future().completeExceptionally(new ScanException("scan abandoned at shutdown", null, false));
    }
  }

  private long currentEpoch() {
    lock.lock();
    try {
      return epoch;
    } finally {
      lock.unlock();
    }
  }

  private void dispatchLoop(Semaphore slots, long runEpoch) {
    MDC.put("component", "scheduler");
    try {
      while (true) {
        slots.acquire();
        PendingRun run;
        try {
          run = awaitDueRun();
        } catch (InterruptedException ie) {
          slots.release();
          throw ie;
        }
        if (run == null) {
          slots.release();
          return;
        }
        ExecutorService pool = currentWorkers();
        if (pool == null) {
          slots.release();
          abandon(run);
          return;
        }
        runningScans.incrementAndGet();
        metrics.observe("scheduler.scan.running", runningScans.get());
        PendingRun dispatched = run;
        try {
          pool.execute(() -> execute(dispatched, slots, runEpoch));
        } catch (RejectedExecutionException ex) {
          runningScans.decrementAndGet();
          slots.release();
          log.debug("Worker pool rejected run of {}; scheduler stopping", run.jobId());
          abandon(run);
          return;
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } finally {
      MDC.remove("component");
    }
  }

  private static void abandon(PendingRun run) {
    if (run.future() != null) {
      run.future().completeExceptionally(new ScanException("scheduler stopped before the scan ran", null, false));
    }
  }

  private ExecutorService currentWorkers() {
    lock.lock();
    try {
      return running ? workers : null;
    } finally {
      lock.unlock();
    }
  }

  private PendingRun awaitDueRun() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (running) {
        PendingRun head = queue.peek();
        if (head == null) {
          wakeup.await(MAX_IDLE_WAIT_MILLIS, TimeUnit.MILLISECONDS);
          continue;
        }
        long now = clock.nowMillis();
        if (head.dueAtMillis() > now) {
          wakeup.await(Math.min(head.dueAtMillis() - now, MAX_IDLE_WAIT_MILLIS), TimeUnit.MILLISECONDS);
          continue;
        }
        queue.poll();
        metrics.observe("scheduler.queue.depth", queue.size());
        if (isStale(head)) {
          log.debug("Skipping stale run of {}", head.jobId());
          continue;
        }
        if (head.kind() == RunKind.RECURRING) {
          JobState job = jobs.get(head.jobId());
          job.nextRun = null;
        }
        return head;
      }
      return null;
    } finally {
      lock.unlock();
    }
  }

  private boolean isStale(PendingRun run) {
    if (run.kind() == RunKind.MANUAL) {
      return false;
    }
    JobState job = jobs.get(run.jobId());
    if (job == null) {
      return true;
    }
    return run.kind() == RunKind.RECURRING && (!job.enabled || job.chainToken != run.chainToken());
  }

  private void execute(PendingRun run, Semaphore slots, long runEpoch) {
    MDC.put("scanJob", run.jobId());
    long started = clock.nowMillis();
    PendingRun attempt = run.firstStartedAtMillis() == null ? run.startedAt(started) : run;
    inFlight.add(run);
    metrics.increment("scheduler.scan.started");
    log.debug("Scan {} attempt {} of {} started", run.jobId(), run.attempt(), run.target());
    try {
      List<Device> devices = scanner.scan(attempt.target(), attempt.profile(), attempt.timeout());
      long finished = clock.nowMillis();
      NetworkSnapshot snapshot;
      try {
        snapshot = NetworkSnapshot.create(Instant.ofEpochMilli(finished), devices,
            new SnapshotMetadata(finished - started, attempt.profile().label(), attempt.target().value(),
                attempt.errors()));
      } catch (IllegalArgumentException invalid) {
        onFailure(attempt, new ScanException("scanner returned an invalid inventory: " + invalid.getMessage(),
            invalid, false), runEpoch);
        return;
      }
      metrics.observe("scheduler.scan.durationMillis", finished - started);
      onSuccess(attempt, snapshot, finished, runEpoch);
    } catch (InterruptedException ie) {
      onCancelled(attempt);
      Thread.currentThread().interrupt();
    } catch (NmapperException ex) {
      onFailure(attempt, ex, runEpoch);
    } catch (RuntimeException ex) {
      onFailure(attempt, new ScanException("scanner failed: " + ex.getMessage(), ex), runEpoch);
    } finally {
      inFlight.remove(run);
      runningScans.decrementAndGet();
      slots.release();
      MDC.remove("scanJob");
    }
  }

  private void onSuccess(PendingRun run, NetworkSnapshot snapshot, long finishedMillis, long runEpoch) {
    ScanEvent.Completed event;
    lock.lock();
    try {
      if (runEpoch != epoch) {
        metrics.increment("scheduler.scan.discarded");
        log.warn("Discarding late result of scan {}", run.jobId());
        failAbandoned(run);
        return;
      }
      Instant finishedAt = Instant.ofEpochMilli(finishedMillis);
      long duration = finishedMillis - run.firstStartedAtMillis();
      record(new ScanExecution(run.jobId(), run.kind(), run.target().value(),
          Instant.ofEpochMilli(run.firstStartedAtMillis()), finishedAt, run.attempt(),
          ScanExecution.Status.SUCCEEDED, snapshot.deviceCount(), null));
      completedRuns++;
      completedDurationMillis += duration;
      lastCompletedRun = finishedAt;
      JobState job = jobs.get(run.jobId());
      if (job != null) {
        job.runCount++;
        job.lastRun = finishedAt;
        job.lastError = null;
        job.updatedAt = finishedAt;
        continueChain(job, run, finishedMillis);
      }
      event = new ScanEvent.Completed(run.jobId(), run.kind(), snapshot, run.attempt(), new CompletableFuture<>());
    } finally {
      lock.unlock();
    }
    metrics.increment("scheduler.scan.completed");
    log.info("Scan {} of {} completed after {} attempt(s) with {} devices",
        run.jobId(), run.target(), run.attempt(), snapshot.deviceCount());
    events.offer(event);
    if (run.future() != null) {
      run.future().complete(event);
    }
  }

  private void onFailure(PendingRun run, NmapperException failure, long runEpoch) {
    String message = Strings.abbreviate(
        failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage(), MAX_ERROR_LENGTH);
    ScanEvent.Failed event;
    lock.lock();
    try {
      if (runEpoch != epoch) {
        metrics.increment("scheduler.scan.discarded");
        log.warn("Discarding late failure of scan {}: {}", run.jobId(), message);
        failAbandoned(run);
        return;
      }
      long now = clock.nowMillis();
      if (running && failure.retryable() && run.attempt() <= settings.maxRetries() && !isStale(run)) {
        long delay = settings.retryBackoff().delayBefore(run.attempt()).toMillis();
        enqueue(run.retry(now + delay, sequence.incrementAndGet(), "attempt " + run.attempt() + ": " + message));
        metrics.increment("scheduler.scan.retry");
        log.warn("Scan {} attempt {}/{} failed; retrying in {} ms: {}",
            run.jobId(), run.attempt(), settings.maxRetries() + 1, delay, message);
        return;
      }
      Instant finishedAt = Instant.ofEpochMilli(now);
      record(new ScanExecution(run.jobId(), run.kind(), run.target().value(),
          Instant.ofEpochMilli(run.firstStartedAtMillis()), finishedAt, run.attempt(),
          ScanExecution.Status.FAILED, 0, message));
      failedRuns++;
      JobState job = jobs.get(run.jobId());
      if (job != null) {
        job.runCount++;
        job.failureCount++;
        job.lastRun = finishedAt;
        job.lastError = message;
        job.updatedAt = finishedAt;
        continueChain(job, run, now);
      }
      event = new ScanEvent.Failed(run.jobId(), run.kind(), run.target().value(), run.attempt(), message);
    } finally {
      lock.unlock();
    }
    metrics.increment("scheduler.scan.failed");
    log.error("Scan {} of {} failed after {} attempt(s): {}", run.jobId(), run.target(), run.attempt(), message);
    events.offer(event);
    if (run.future() != null) {
      run.future().completeExceptionally(failure);
    }
  }

  private void onCancelled(PendingRun run) {
    lock.lock();
    try {
      Instant now = clock.now();
      record(new ScanExecution(run.jobId(), run.kind(), run.target().value(),
          Instant.ofEpochMilli(run.firstStartedAtMillis()), now, run.attempt(),
          ScanExecution.Status.CANCELLED, 0, "cancelled"));
    } finally {
      lock.unlock();
    }
    metrics.increment("scheduler.scan.cancelled");
    log.info("Scan {} cancelled", run.jobId());
    if (run.future() != null) {
      run.future().completeExceptionally(new ScanException("scan cancelled", null, false));
    }
  }

  private void continueChain(JobState job, PendingRun run, long nowMillis) {
    if (run.kind() != RunKind.RECURRING || !running || !job.enabled || job.chainToken != run.chainToken()) {
      return;
    }
    long next = Math.max(run.occurrenceDueAtMillis() + job.interval.toMillis(), nowMillis);
    enqueue(PendingRun.first(job.id, RunKind.RECURRING, job.target, job.profile, job.timeout, next,
        sequence.incrementAndGet(), job.chainToken, null));
    job.nextRun = Instant.ofEpochMilli(next);
  }

  private void startChain(JobState job, long dueAtMillis) {
    job.chainToken++;
    enqueue(PendingRun.first(job.id, RunKind.RECURRING, job.target, job.profile, job.timeout, dueAtMillis,
        sequence.incrementAndGet(), job.chainToken, null));
    job.nextRun = Instant.ofEpochMilli(dueAtMillis);
  }

  private void enqueue(PendingRun run) {
    queue.add(run);
    metrics.observe("scheduler.queue.depth", queue.size());
    wakeup.signalAll();
  }

  private void record(ScanExecution execution) {
    history.addLast(execution);
    while (history.size() > settings.historyLimit()) {
      history.removeFirst();
    }
  }

  private JobState requireJob(String jobId) {
    JobState job = jobId == null ? null : jobs.get(jobId);
    if (job == null) {
      throw new NotFoundException("scan job not found: " + jobId);
    }
    return job;
  }

  private void requireRunning() {
    if (!running) {
      throw new WrongStateException("scan scheduler is not running");
    }
  }

  private void validateInterval(Duration interval) {
    if (interval == null) {
      throw new ValidationException("interval is required");
    }
    if (interval.compareTo(settings.minInterval()) < 0 || interval.compareTo(settings.maxInterval()) > 0) {
      throw new ValidationException("interval must be between " + settings.minInterval().toSeconds() + " s and "
          + settings.maxInterval().toSeconds() + " s (got " + interval.toMillis() + " ms)");
    }
  }

  private Duration validateTimeout(Duration timeout) {
    if (timeout == null) {
      return settings.defaultTimeout();
    }
    if (timeout.compareTo(SchedulerSettings.MIN_TIMEOUT) < 0 || timeout.compareTo(SchedulerSettings.MAX_TIMEOUT) > 0) {
      throw new ValidationException("timeout must be between " + SchedulerSettings.MIN_TIMEOUT.toSeconds()
          + " s and " + SchedulerSettings.MAX_TIMEOUT.toSeconds() + " s");
    }
    return timeout;
  }

  private void onUncaught(Thread thread, Throwable ex) {
    metrics.increment("scheduler.thread.uncaught");
    log.error("Uncaught exception on {}", thread.getName(), ex);
  }

  private static RuntimeException unwrap(ExecutionException ex) {
    Throwable cause = ex.getCause();
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new ScanException("manual scan failed", cause);
  }

  /** Mutable registration; guarded by the scheduler lock. */
  private static final class JobState {
    final String id;
    final String name;
    final ScanTarget target;
    final ScanProfile profile;
    final Duration interval;
    final Duration timeout;
    final Instant createdAt;
    boolean enabled;
    long runCount;
    long failureCount;
    Instant lastRun;
    Instant nextRun;
    Instant updatedAt;
    String lastError;
    long chainToken;

    JobState(String id, String name, ScanTarget target, ScanProfile profile, Duration interval, Duration timeout,
        Instant createdAt) {
      this.id = id;
      this.name = name;
      this.target = target;
      this.profile = profile;
      this.interval = interval;
      this.timeout = timeout;
      this.createdAt = createdAt;
      this.updatedAt = createdAt;
    }

    ScheduledScan view() {
      return new ScheduledScan(id, name, target, profile, interval, timeout, enabled, runCount, failureCount,
          lastRun, nextRun, createdAt, updatedAt, lastError);
    }
  }

  /** One queued attempt of a scan invocation. */
  private record PendingRun(
      String jobId,
      RunKind kind,
      ScanTarget target,
      ScanProfile profile,
      Duration timeout,
      int attempt,
      long dueAtMillis,
      long occurrenceDueAtMillis,
      long sequence,
      long chainToken,
      Long firstStartedAtMillis,
      List<String> errors,
      CompletableFuture<ScanEvent.Completed> future) {

    static final Comparator<PendingRun> ORDER =
        Comparator.comparingLong(PendingRun::dueAtMillis).thenComparingLong(PendingRun::sequence);

    static PendingRun first(String jobId, RunKind kind, ScanTarget target, ScanProfile profile, Duration timeout,
        long dueAtMillis, long sequence, long chainToken, CompletableFuture<ScanEvent.Completed> future) {
      return new PendingRun(jobId, kind, target, profile, timeout, 1, dueAtMillis, dueAtMillis, sequence,
          chainToken, null, List.of(), future);
    }

    PendingRun startedAt(long millis) {
      return new PendingRun(jobId, kind, target, profile, timeout, attempt, dueAtMillis, occurrenceDueAtMillis,
          sequence, chainToken, millis, errors, future);
    }

    PendingRun retry(long dueAt, long nextSequence, String error) {
      List<String> nextErrors = new ArrayList<>(errors);
      nextErrors.add(error);
      return new PendingRun(jobId, kind, target, profile, timeout, attempt + 1, dueAt, occurrenceDueAtMillis,
          nextSequence, chainToken, firstStartedAtMillis, List.copyOf(nextErrors), future);
    }
  }
}
