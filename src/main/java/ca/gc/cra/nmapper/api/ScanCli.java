package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.api.CliSupport.CliAbort;
import ca.gc.cra.nmapper.application.monitoring.MonitoringOrchestrator;
import ca.gc.cra.nmapper.application.scheduling.SchedulerSettings;
import ca.gc.cra.nmapper.config.CompositionRoot;
import ca.gc.cra.nmapper.config.MonitorConfig;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one manual scan through the full pipeline (scan, snapshot, diff against the latest stored snapshot) and
 * prints the resulting snapshot.
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  static final String MODE = "scan";
  private static final String SUMMARY_USAGE =
      "usage: scan range=CIDR|IP|A-B [profile=quick|discovery|comprehensive] [timeout=5s-5m] "
          + "[format=text|json] [config=PATH] [scanner.command='CMD {target}'] [storage.type=jdbc|memory] "
          + "[--dry-run] [--verbose|--quiet]";
  private static final String HELP_TEXT = """
      nmapper scan: run one scan now and store its snapshot

      Usage:
        scan range=<target> [options]

      Required:
        range=CIDR|IP|A-B          Target, e.g. 192.168.1.0/24, 10.0.0.5 or 10.0.0.1-10.0.0.40

      Optional:
        profile=quick|discovery|comprehensive   Scan profile (default discovery)
        timeout=5s-5m              Per-attempt timeout (default scheduler.scanTimeout)
        format=text|json           Output format (default text)
        config=PATH                YAML file with 'common' and 'scan' sections
        scanner.command='CMD ARGS' External scanner command
        storage.type=jdbc|memory   storage.url=JDBC_URL
        notify.sink=log|kafka|none
        scheduler.maxRetries=0-5   Retries after a failed attempt
        --dry-run                  Validate inputs and print the plan without scanning
        --verbose | --quiet        DEBUG or WARN logging
        --help                     Show this message
      """;

  private ScanCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the scan command.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliSupport.applyLogging(input, log, MODE);

    Map<String, String> effective;
    MonitorConfig config;
    ScanRequest request;
    try {
      effective = CliSupport.effectiveConfig(MODE, input, SUMMARY_USAGE, log);
      request = ScanRequest.from(effective, SUMMARY_USAGE);
      config = CliSupport.monitorConfig(effective, SUMMARY_USAGE, log);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }
    if (!config.scanner().enabled()) {
      log.error("scanner.command is required for scan");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      CliPrinter.printLines(
          "Scan dry-run: nothing will be scanned or stored.",
          " Target   : " + request.target(),
          " Profile  : " + request.profile().label(),
          " Timeout  : " + (request.timeout() == null
              ? config.scheduler().defaultTimeout() : request.timeout()),
          " Retries  : " + config.scheduler().maxRetries(),
          " Scanner  : " + String.join(" ", config.scanner().command()),
          " Storage  : " + config.storage());
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      Output output;
      try {
        output = Output.forFormat(CliSupport.option(effective, "format"), root.json());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid argument: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      MonitoringOrchestrator orchestrator = root.orchestrator();
      orchestrator.start();
      log.info("Scanning {} with profile {}", request.target(), request.profile().label());
      NetworkSnapshot snapshot =
          orchestrator.triggerManualScan(request.target().value(), request.profile(), request.timeout());
      SnapshotDiff diff = orchestrator.getRecentChanges(1).stream()
          .filter(candidate -> snapshot.id().equals(candidate.toSnapshot()))
          .findFirst()
          .orElse(null);
      output.snapshot(snapshot, diff);
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      return CliSupport.interrupted(ex, log, "Scan");
    } catch (RuntimeException ex) {
      return CliSupport.failure(ex, log, "Scan");
    }
  }

  private record ScanRequest(ScanTarget target, ScanProfile profile, Duration timeout) {
    static ScanRequest from(Map<String, String> options, String usage) throws CliAbort {
      String range = CliSupport.option(options, "range");
      if (range == null) {
        log.error("range is required");
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      try {
        ScanTarget target = ScanTarget.parse(range);
        ScanProfile profile = ScanProfile.from(CliSupport.option(options, "profile"));
        String rawTimeout = CliSupport.option(options, "timeout");
        Duration timeout = rawTimeout == null
            ? null
            : Numbers.parseDuration("timeout", rawTimeout, SchedulerSettings.MIN_TIMEOUT,
                SchedulerSettings.MAX_TIMEOUT);
        return new ScanRequest(target, profile, timeout);
      } catch (ValidationException | IllegalArgumentException ex) {
        log.error("Invalid scan request: {}", ex.getMessage());
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
    }
  }
}
