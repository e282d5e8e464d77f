package ca.gc.cra.nmapper.api;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code nmapper} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: nmapper <monitor|scan|snapshots|diff> [options]";
  private static final String HELP_TEXT = """
      nmapper: network inventory monitor

      Usage:
        nmapper <command> [key=value ...] [flags]

      Commands:
        monitor     Run scheduled scans, store snapshots and report changes until stopped
        scan        Run one scan now and store its snapshot
        snapshots   List, show or summarize stored snapshots
        diff        Compare stored snapshots or list recent changes

      Global flags:
        --help      Show this message (or a command's help after the command name)
        --verbose   DEBUG logging
        --quiet     WARN logging

      Every command accepts config=PATH pointing at a YAML file with a 'common' section and one section per
      command. Command-line key=value pairs override the YAML file.
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches to a command and returns its exit code without terminating the JVM.
   *
   * @param args command name followed by its arguments
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] arguments = input.arguments();
    if (arguments.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = arguments[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = input.delegateArguments();
    return switch (command) {
      case MonitorCli.MODE -> MonitorCli.run(delegateArgs);
      case ScanCli.MODE -> ScanCli.run(delegateArgs);
      case SnapshotsCli.MODE -> SnapshotsCli.run(delegateArgs);
      case DiffCli.MODE -> DiffCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
