package ca.gc.cra.nmapper.domain.error;

/**
 * Rejected input such as an invalid scan range or interval.
 *
 * @since 0.1.0
 */
public class ValidationException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public ValidationException(String message) {
    super(ErrorCategory.VALIDATION, message, null);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorCategory.VALIDATION, message, cause);
  }
}
