package ca.gc.cra.nmapper.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named, non-daemon executors used by the scheduler and orchestrator.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for scan workers. Callers bound submissions themselves, so the queue is unbounded.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedFactory(prefix, "nmapper-worker", handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded executor for a dedicated loop such as dispatch or event handling.
   *
   * @param name thread name
   * @param handler uncaught exception handler
   * @return configured executor service
   */
  public static ExecutorService newSingleThread(String name, UncaughtExceptionHandler handler) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedFactory(name, "nmapper-loop", handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-threaded scheduled executor for periodic housekeeping.
   *
   * @param name thread name
   * @param handler uncaught exception handler
   * @return configured scheduled executor
   */
  public static ScheduledExecutorService newTicker(String name, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, namedFactory(name, "nmapper-ticker", handler));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }

  private static ThreadFactory namedFactory(String prefix, String fallback, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
