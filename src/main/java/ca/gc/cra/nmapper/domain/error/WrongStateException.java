package ca.gc.cra.nmapper.domain.error;

/**
 * A lifecycle operation was requested in a state that does not allow it.
 *
 * @since 0.1.0
 */
public class WrongStateException extends NmapperException {
  private static final long serialVersionUID = 1L;

  public WrongStateException(String message) {
    super(ErrorCategory.WRONG_STATE, message, null);
  }

  public WrongStateException(String message, Throwable cause) {
    super(ErrorCategory.WRONG_STATE, message, cause);
  }
}
