package ca.gc.cra.nmapper.domain.error;

/**
 * A write collided with an existing row; callers treat duplicate diffs as no-ops.
 *
 * @since 0.1.0
 */
public class ConflictException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public ConflictException(String message) {
    super(ErrorCategory.CONFLICT, message, null);
  }

  public ConflictException(String message, Throwable cause) {
    super(ErrorCategory.CONFLICT, message, cause);
  }
}
