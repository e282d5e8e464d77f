package ca.gc.cra.nmapper.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime log-level switches for the {@code --verbose} and {@code --quiet} CLI flags.
 * <p><strong>Thread-safety:</strong> Call once from the CLI thread before the monitor starts.</p>
 *
 * @implNote Logback only; other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Lowers the root threshold to DEBUG. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /** Raises the root threshold to WARN so only problems reach the console. */
  public static void enableQuietLogging() {
    setRootLevel(Level.WARN);
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
