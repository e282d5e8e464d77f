package ca.gc.cra.nmapper.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into logging flags, other {@code --flags} and positional/{@code key=value} tokens.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> QUIET_FLAGS = Set.of("--quiet", "-q");

  private final List<String> arguments;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;
  private final boolean quiet;

  private CliInput(List<String> arguments, Set<String> flags, boolean help, boolean verbose, boolean quiet) {
    this.arguments = arguments;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
    this.quiet = quiet;
  }

  /**
   * Partitions raw arguments. Blank and {@code null} tokens are dropped; {@code --name=value} tokens are kept as
   * arguments so {@link CliArgsParser} can read them.
   *
   * @param args raw arguments (may be {@code null})
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> arguments = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    boolean quiet = false;
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (QUIET_FLAGS.contains(lower)) {
        quiet = true;
      } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
        flags.add(lower);
      } else {
        arguments.add(arg);
      }
    }
    return new CliInput(List.copyOf(arguments), Set.copyOf(flags), help, verbose && !quiet, quiet);
  }

  /**
   * Positional and {@code key=value} tokens in their original order.
   *
   * @return copy of the remaining arguments
   */
  public String[] arguments() {
    return arguments.toArray(String[]::new);
  }

  /**
   * Arguments after the first one, used by the dispatcher to hand a command its own arguments.
   *
   * @return trailing arguments, flags re-attached so the command sees them too
   */
  String[] delegateArguments() {
    List<String> rest = new ArrayList<>(arguments.subList(Math.min(1, arguments.size()), arguments.size()));
    rest.addAll(flags);
    if (help) {
      rest.add("--help");
    }
    if (verbose) {
      rest.add("--verbose");
    }
    if (quiet) {
      rest.add("--quiet");
    }
    return rest.toArray(String[]::new);
  }

  public boolean help() {
    return help;
  }

  /**
   * Whether DEBUG logging was requested. {@code --quiet} wins when both are given.
   *
   * @return {@code true} for {@code --verbose}, {@code -v} or {@code --debug}
   */
  public boolean verbose() {
    return verbose;
  }

  public boolean quiet() {
    return quiet;
  }

  /**
   * Checks a flag such as {@code --json}.
   *
   * @param flag flag to query, case-insensitive
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "CliInput" + Arrays.asList(arguments()) + flags;
  }
}
