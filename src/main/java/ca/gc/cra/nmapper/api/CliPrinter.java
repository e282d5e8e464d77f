package ca.gc.cra.nmapper.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Writes command results to stdout. Logs go through SLF4J; this writer carries only the output a user or script
 * asked for (tables, JSON, usage text).
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints each line in turn.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints a formatted line using {@link Locale#ROOT} so numbers do not change with the host locale.
   *
   * @param format format string without trailing newline
   * @param args format arguments
   */
  public static void printf(String format, Object... args) {
    PrintWriter writer = writer();
    writer.println(String.format(Locale.ROOT, format, args));
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter test = override;
    return test != null ? test : STDOUT;
  }
}
