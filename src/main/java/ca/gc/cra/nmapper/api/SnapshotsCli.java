package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.api.CliSupport.CliAbort;
import ca.gc.cra.nmapper.application.monitoring.MonitoringOrchestrator;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.config.CompositionRoot;
import ca.gc.cra.nmapper.config.MonitorConfig;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.validation.Net;
import ca.gc.cra.nmapper.validation.Numbers;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists, shows and summarizes stored snapshots.
 *
 * @since 0.1.0
 */
public final class SnapshotsCli {
  private static final Logger log = LoggerFactory.getLogger(SnapshotsCli.class);
  static final String MODE = "snapshots";
  private static final Duration MAX_LOOKBACK = Duration.ofDays(3650);
  private static final String SUMMARY_USAGE =
      "usage: snapshots [id=ID|--latest|--stats] [page=N] [size=5-100] [sortBy=timestamp|deviceCount|totalPorts] "
          + "[order=asc|desc] [deviceIp=IP] [since=ISO|24h] [until=ISO|1h] [format=text|json] [config=PATH]";
  private static final String HELP_TEXT = """
      nmapper snapshots: browse stored snapshots

      Usage:
        snapshots [options]

      Selection:
        id=SNAPSHOT_ID           Show one snapshot
        --latest                 Show the most recent snapshot
        --stats                  Per scan type statistics

      Listing (default):
        page=1                   1-based page number
        size=25                  Page size (5-100)
        sortBy=timestamp|deviceCount|totalPorts
        order=asc|desc           Sort direction (default desc)
        deviceIp=IP              Only snapshots containing this device
        since=ISO|DURATION       Taken at or after, e.g. 2024-05-01T00:00:00Z or 24h
        until=ISO|DURATION       Taken at or before

      Output and storage:
        format=text|json         Output format (default text)
        config=PATH              YAML file with 'common' and 'snapshots' sections
        storage.type=jdbc|memory storage.url=JDBC_URL
        --verbose | --quiet      DEBUG or WARN logging
        --help                   Show this message
      """;

  private SnapshotsCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the snapshots command.
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
    try {
      effective = CliSupport.effectiveConfig(MODE, input, SUMMARY_USAGE, log);
      config = CliSupport.monitorConfig(effective, SUMMARY_USAGE, log);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      Output output;
      SnapshotQuery query;
      PageRequest page;
      try {
        output = Output.forFormat(CliSupport.option(effective, "format"), root.json());
        query = query(effective, Instant.now());
        page = new PageRequest(
            (int) Numbers.parseInRange("page", effective.getOrDefault("page", "1"), 1, Integer.MAX_VALUE),
            (int) Numbers.parseInRange("size", effective.getOrDefault("size", "25"),
                PageRequest.MIN_SIZE, PageRequest.MAX_SIZE));
      } catch (ValidationException | IllegalArgumentException ex) {
        log.error("Invalid argument: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }

      root.snapshotStore().initialize();
      MonitoringOrchestrator orchestrator = root.orchestrator();
      String id = CliSupport.option(effective, "id");
      if (id != null) {
        output.snapshot(orchestrator.getSnapshot(id), null);
      } else if (input.hasFlag("--latest")) {
        NetworkSnapshot latest = orchestrator.getLatestSnapshot()
            .orElseThrow(() -> new NotFoundException("no snapshots stored"));
        output.snapshot(latest, null);
      } else if (input.hasFlag("--stats")) {
        output.statistics(orchestrator.getStatistics());
      } else {
        output.snapshots(orchestrator.listSnapshots(query, page));
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.failure(ex, log, "Snapshot query");
    }
  }

  static SnapshotQuery query(Map<String, String> options, Instant now) {
    String deviceIp = CliSupport.option(options, "deviceIp");
    if (deviceIp != null) {
      Net.validateIpLiteral(deviceIp);
    }
    String order = options.getOrDefault("order", "desc").trim().toLowerCase(Locale.ROOT);
    if (!order.equals("asc") && !order.equals("desc")) {
      throw new IllegalArgumentException("order must be asc or desc (was " + order + ")");
    }
    return new SnapshotQuery(
        instant("since", CliSupport.option(options, "since"), now),
        instant("until", CliSupport.option(options, "until"), now),
        deviceIp,
        SnapshotQuery.SortField.from(CliSupport.option(options, "sortBy")),
        order.equals("desc"));
  }

  /**
   * Reads an ISO-8601 instant, or a duration such as {@code 24h} counted back from {@code now}.
   */
  static Instant instant(String name, String raw, Instant now) {
    if (raw == null) {
      return null;
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      return now.minus(Numbers.parseDuration(name, raw, Duration.ZERO, MAX_LOOKBACK));
    }
  }
}
