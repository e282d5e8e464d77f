package ca.gc.cra.nmapper.domain.error;

/**
 * A protected operation was rejected, for example by an open circuit breaker.
 *
 * @since 0.1.0
 */
public class ServiceUnavailableException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public ServiceUnavailableException(String message) {
    super(ErrorCategory.SERVICE_UNAVAILABLE, message, null);
  }

  public ServiceUnavailableException(String message, Throwable cause) {
    super(ErrorCategory.SERVICE_UNAVAILABLE, message, cause);
  }
}
