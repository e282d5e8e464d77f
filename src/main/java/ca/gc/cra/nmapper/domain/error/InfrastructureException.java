package ca.gc.cra.nmapper.domain.error;

/**
 * Storage or connectivity failure. Retryable unless constructed otherwise.
 *
 * @since 0.1.0
 */
public class InfrastructureException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public InfrastructureException(String message, Throwable cause) {
    super(ErrorCategory.INFRASTRUCTURE, message, cause);
  }

  public InfrastructureException(String message, Throwable cause, boolean retryable) {
    super(ErrorCategory.INFRASTRUCTURE, message, cause, retryable);
  }
}
