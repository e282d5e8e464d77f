package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.api.CliSupport.CliAbort;
import ca.gc.cra.nmapper.application.monitoring.MonitoringOrchestrator;
import ca.gc.cra.nmapper.application.port.Page;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.config.CompositionRoot;
import ca.gc.cra.nmapper.config.MonitorConfig;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.validation.Numbers;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares two stored snapshots, or lists the changes detected in a recent window.
 *
 * @since 0.1.0
 */
public final class DiffCli {
  private static final Logger log = LoggerFactory.getLogger(DiffCli.class);
  static final String MODE = "diff";
  private static final String SUMMARY_USAGE =
      "usage: diff (from=ID to=ID | --latest | recent=HOURS) [format=text|json] [config=PATH]";
  private static final String HELP_TEXT = """
      nmapper diff: compare stored snapshots

      Usage:
        diff from=ID to=ID       Compare two snapshots (older first)
        diff --latest            Compare the two most recent snapshots
        diff recent=HOURS        Changes detected in the last 1-8760 hours

      Options:
        format=text|json         Output format (default text)
        config=PATH              YAML file with 'common' and 'diff' sections
        storage.type=jdbc|memory storage.url=JDBC_URL
        diff.identityPolicy=ip|ip_then_mac
        --verbose | --quiet      DEBUG or WARN logging
        --help                   Show this message
      """;

  private DiffCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the diff command.
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

    String from = CliSupport.option(effective, "from");
    String to = CliSupport.option(effective, "to");
    String recent = CliSupport.option(effective, "recent");
    boolean latest = input.hasFlag("--latest");
    boolean pair = from != null || to != null;
    if ((pair ? 1 : 0) + (latest ? 1 : 0) + (recent != null ? 1 : 0) != 1 || (pair && (from == null || to == null))) {
      log.error("Give either from= and to=, --latest or recent=");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    int hours = 0;
    if (recent != null) {
      try {
        hours = (int) Numbers.parseInRange("recent", recent, 1, MonitoringOrchestrator.MAX_RECENT_HOURS);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid argument: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
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
      root.snapshotStore().initialize();
      MonitoringOrchestrator orchestrator = root.orchestrator();
      if (recent != null) {
        printRecent(orchestrator.getRecentChanges(hours), output, root);
      } else if (latest) {
        Page<NetworkSnapshot> newest = orchestrator.listSnapshots(SnapshotQuery.all(),
            new PageRequest(1, PageRequest.MIN_SIZE));
        if (newest.items().size() < 2) {
          throw new NotFoundException("at least two snapshots are needed; " + newest.items().size() + " stored");
        }
        output.diff(orchestrator.compareSnapshots(newest.items().get(1).id(), newest.items().get(0).id()));
      } else {
        output.diff(orchestrator.compareSnapshots(from, to));
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      return CliSupport.failure(ex, log, "Diff");
    }
  }

  private static void printRecent(List<SnapshotDiff> diffs, Output output, CompositionRoot root) {
    if (output.json()) {
      CliPrinter.println(root.json().writePretty(diffs));
      return;
    }
    if (diffs.isEmpty()) {
      CliPrinter.println("No changes recorded in that window.");
      return;
    }
    for (SnapshotDiff diff : diffs) {
      CliPrinter.println(diff.timestamp() + "  " + diff.fromSnapshot() + " -> " + diff.toSnapshot() + "  "
          + Output.summaryLine(diff.summary()));
    }
  }
}
