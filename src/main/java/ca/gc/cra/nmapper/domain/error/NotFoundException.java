package ca.gc.cra.nmapper.domain.error;

/**
 * A referenced snapshot, diff or schedule does not exist.
 *
 * @since 0.1.0
 */
public class NotFoundException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public NotFoundException(String message) {
    super(ErrorCategory.NOT_FOUND, message, null);
  }

  public NotFoundException(String message, Throwable cause) {
    super(ErrorCategory.NOT_FOUND, message, cause);
  }
}
