package ca.gc.cra.nmapper.domain.error;

import java.util.Objects;

/**
 * Base unchecked exception for categorized failures.
 *
 * @since 0.1.0
 */
public class NmapperException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorCategory category;
  private final boolean retryable;

  protected NmapperException(ErrorCategory category, String message, Throwable cause) {
    this(category, message, cause, category.retryable());
  }

  protected NmapperException(ErrorCategory category, String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category");
    this.retryable = retryable;
  }

  /**
   * Returns the failure category.
   *
   * @return category; never {@code null}
   */
  public ErrorCategory category() {
    return category;
  }

  /**
   * Indicates whether retrying the failed operation may succeed.
   *
   * @return {@code true} for transient failures
   */
  public boolean retryable() {
    return retryable;
  }

  /**
   * Shortcut for {@code category().statusClass()}.
   *
   * @return status class
   */
  public int statusClass() {
    return category.statusClass();
  }
}
