package ca.gc.cra.nmapper.domain.error;

/**
 * Failure categories with their retry semantics and user-visible status class.
 *
 * @since 0.1.0
 */
public enum ErrorCategory {
  /** Bad input; never retried. */
  VALIDATION(400, false),
  /** Referenced id is absent. */
  NOT_FOUND(404, false),
  /** Duplicate submission; callers treat it as an idempotent no-op. */
  CONFLICT(409, false),
  /** Operation not allowed in the current lifecycle state. */
  WRONG_STATE(409, false),
  /** Storage or connectivity failure; retried with backoff. */
  INFRASTRUCTURE(503, true),
  /** Scan tool failure or timeout; retried per scheduler policy. */
  SCAN(502, true),
  /** Protection tripped (open circuit breaker, retries exhausted). */
  SERVICE_UNAVAILABLE(503, false);

  private final int statusClass;
  private final boolean retryable;

  ErrorCategory(int statusClass, boolean retryable) {
    this.statusClass = statusClass;
    this.retryable = retryable;
  }

  /**
   * HTTP-style status class an API layer should report.
   *
   * @return status code such as {@code 404}
   */
  public int statusClass() {
    return statusClass;
  }

  /**
   * Whether failures of this category are transient by default.
   *
   * @return {@code true} when retrying may succeed
   */
  public boolean retryable() {
    return retryable;
  }
}
