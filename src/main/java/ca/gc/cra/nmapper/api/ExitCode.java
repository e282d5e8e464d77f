package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.domain.error.NmapperException;

/**
 * <strong>What:</strong> Process exit codes shared by every {@code nmapper} command.
 * <p><strong>Why:</strong> Scripts and service managers react to the numeric status, so each failure class keeps
 * a stable value.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments or the merged configuration were invalid. */
  INVALID_ARGS(2),
  /** Configuration or output file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was accepted but adapters could not be built from it. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** A requested snapshot or diff does not exist. */
  NOT_FOUND(6),
  /** The scanner failed after all retries. */
  SCAN_FAILED(7),
  /** Storage unreachable or protection tripped (open circuit breaker). */
  UNAVAILABLE(8),
  /** Interrupted, usually by SIGINT. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric value handed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }

  /**
   * Maps a domain failure onto an exit code by its category.
   *
   * @param error failure raised by the monitor
   * @return matching exit code
   */
  public static ExitCode forError(NmapperException error) {
    return switch (error.category()) {
      case VALIDATION -> INVALID_ARGS;
      case NOT_FOUND -> NOT_FOUND;
      case SCAN -> SCAN_FAILED;
      case INFRASTRUCTURE, SERVICE_UNAVAILABLE -> UNAVAILABLE;
      case CONFLICT, WRONG_STATE -> RUNTIME_FAILURE;
    };
  }
}
