package ca.gc.cra.nmapper.domain.error;

/**
 * Scan tool failure, timeout or unparseable output.
 *
 * @since 0.1.0
 */
public class ScanException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public ScanException(String message) {
    super(ErrorCategory.SCAN, message, null);
  }

  public ScanException(String message, Throwable cause) {
    super(ErrorCategory.SCAN, message, cause);
  }

  /**
   * Creates a scan failure with explicit retry semantics, e.g. a disabled scanner that will never succeed.
   *
   * @param message failure detail
   * @param cause underlying cause; may be {@code null}
   * @param retryable whether the scheduler should retry
   */
  public ScanException(String message, Throwable cause, boolean retryable) {
    super(ErrorCategory.SCAN, message, cause, retryable);
  }
}
