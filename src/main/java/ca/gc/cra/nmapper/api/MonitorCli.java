package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.api.CliSupport.CliAbort;
import ca.gc.cra.nmapper.application.monitoring.MonitorSettings;
import ca.gc.cra.nmapper.application.monitoring.MonitoringOrchestrator;
import ca.gc.cra.nmapper.config.CompositionRoot;
import ca.gc.cra.nmapper.config.MonitorConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the network monitor until the process is asked to stop (SIGINT/SIGTERM).
 *
 * @since 0.1.0
 */
public final class MonitorCli {
  private static final Logger log = LoggerFactory.getLogger(MonitorCli.class);
  static final String MODE = "monitor";
  private static final Duration HOOK_SLACK = Duration.ofSeconds(5);
  private static final String SUMMARY_USAGE =
      "usage: monitor [config=PATH] [monitor.range=CIDR] [monitor.interval=5m] [monitor.profile=discovery] "
          + "[scanner.command='CMD {target}'] [storage.type=jdbc|memory] [storage.url=JDBC_URL] "
          + "[notify.sink=log|kafka|none] [--dry-run] [--verbose|--quiet]";
  private static final String HELP_TEXT = """
      nmapper monitor: scheduled scans, snapshots and change detection

      Usage:
        monitor [config=PATH] [key=value ...]

      Common options:
        config=PATH                     YAML file with 'common' and 'monitor' sections
        monitor.range=CIDR|IP|A-B       Default recurring scan target (requires scanner.command)
        monitor.interval=5m             Recurrence of the default scan
        monitor.profile=quick|discovery|comprehensive
        monitor.significantChangeThreshold=10   Changes that trigger a notification (0 disables)
        monitor.retention=30d           Snapshots older than this are swept daily
        scanner.command='CMD ARGS'      External scanner; {target}, {profile}, {timeoutSeconds} are replaced
        storage.type=jdbc|memory        Snapshot store (default jdbc)
        storage.url=JDBC_URL            e.g. jdbc:postgresql://localhost:5432/nmapper
        storage.user=NAME storage.password=SECRET
        notify.sink=log|kafka|none      Significant change and scan failure sink (default log)
        notify.kafkaBootstrap=HOST:PORT notify.kafkaTopic=TOPIC
        scheduler.maxConcurrentScans=3  scheduler.maxRetries=3  scheduler.scanTimeout=5m
        diff.identityPolicy=ip|ip_then_mac
        metricsExporter=otlp|none       otelEndpoint=URL  otelResourceAttributes=K=V,...
        --dry-run                       Print the effective settings and exit
        --verbose | --quiet             DEBUG or WARN logging
        --help                          Show this message

      The monitor stops gracefully on SIGINT or SIGTERM.
      """;

  private MonitorCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the monitor until a JVM shutdown is requested.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, null);
  }

  /**
   * Runs the monitor until {@code stopSignal} opens. With a {@code null} signal a shutdown hook provides one.
   *
   * @param args raw CLI arguments
   * @param stopSignal latch released when the monitor should stop; {@code null} to use a shutdown hook
   * @return exit code
   */
  static ExitCode run(String[] args, CountDownLatch stopSignal) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliSupport.applyLogging(input, log, MODE);

    MonitorConfig config;
    String exporter;
    try {
      Map<String, String> effective = CliSupport.effectiveConfig(MODE, input, SUMMARY_USAGE, log);
      exporter = effective.getOrDefault("metricsExporter", "otlp");
      config = CliSupport.monitorConfig(effective, SUMMARY_USAGE, log);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    log.info("Configured monitor: storage={}, scanner={}, notify={}, metricsExporter={}",
        config.storage().type(), config.scanner().enabled() ? "command" : "disabled",
        config.notification().sink(), exporter);
    if (input.hasFlag("--dry-run")) {
      printPlan(config);
      return ExitCode.SUCCESS;
    }

    CountDownLatch released = new CountDownLatch(1);
    CountDownLatch signal = stopSignal;
    Thread hook = null;
    if (signal == null) {
      signal = new CountDownLatch(1);
      hook = installShutdownHook(signal, released, shutdownBudget(config));
    }
    try (CompositionRoot root = new CompositionRoot(config)) {
      MonitoringOrchestrator orchestrator = root.orchestrator();
      orchestrator.start();
      Output output = Output.forFormat("text", root.json());
      output.health(orchestrator.checkHealth());
      signal.await();
      log.info("Stop requested; shutting down monitor");
      orchestrator.stop();
      output.metrics(orchestrator.getMetrics());
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      return CliSupport.interrupted(ex, log, "Monitor");
    } catch (RuntimeException ex) {
      return CliSupport.failure(ex, log, "Monitor");
    } finally {
      released.countDown();
      removeShutdownHook(hook);
    }
  }

  private static Thread installShutdownHook(CountDownLatch stop, CountDownLatch released, Duration budget) {
    Thread hook = new Thread(() -> {
      stop.countDown();
      try {
        if (!released.await(budget.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Monitor did not stop within {} ms; exiting anyway", budget.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "nmapper-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }

  private static void removeShutdownHook(Thread hook) {
    if (hook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook stays registered");
    }
  }

  private static Duration shutdownBudget(MonitorConfig config) {
    return config.scheduler().shutdownGrace()
        .plus(config.monitor().gracefulShutdownTimeout())
        .plus(HOOK_SLACK);
  }

  private static void printPlan(MonitorConfig config) {
    MonitorSettings monitor = config.monitor();
    MonitorSettings.DefaultScan scan = monitor.defaultScan();
    CliPrinter.printLines(
        "Monitor dry-run: nothing will be scanned or stored.",
        " Storage          : " + config.storage(),
        " Scanner          : " + (config.scanner().enabled()
            ? String.join(" ", config.scanner().command()) : "<disabled>"),
        " Default scan     : " + (scan == null
            ? "<none>" : scan.range() + " every " + scan.interval() + " (" + scan.profile().label() + ")"),
        " Max concurrency  : " + config.scheduler().maxConcurrentScans(),
        " Max retries      : " + config.scheduler().maxRetries(),
        " Change threshold : " + monitor.significantChangeThreshold(),
        " Retention        : " + monitor.retention(),
        " Health interval  : " + monitor.healthCheckInterval(),
        " Notifications    : " + config.notification().sink(),
        " Diff identity    : " + config.diff().identityPolicy(),
        " Re-run without --dry-run to start monitoring.");
  }
}
