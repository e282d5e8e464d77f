package ca.gc.cra.nmapper.application.port;

import ca.gc.cra.nmapper.domain.error.ValidationException;

/**
 * One-based pagination request.
 *
 * @param page page number, starting at 1
 * @param size page size in {@code 5..100}
 * @since 0.1.0
 */
public record PageRequest(int page, int size) {
  /** Default page size. */
  public static final int DEFAULT_SIZE = 25;
  /** Smallest accepted page size. */
  public static final int MIN_SIZE = 5;
  /** Largest accepted page size. */
  public static final int MAX_SIZE = 100;

  /**
   * Validates the request.
   *
   * @throws ValidationException if the page is below 1 or the size is out of range
   */
  public PageRequest {
    if (page < 1) {
      throw new ValidationException("page must be >= 1 (was " + page + ")");
    }
    if (size < MIN_SIZE || size > MAX_SIZE) {
      throw new ValidationException(
          "page size must be between " + MIN_SIZE + " and " + MAX_SIZE + " (was " + size + ")");
    }
  }

  /**
   * First page with the default size.
   *
   * @return default request
   */
  public static PageRequest first() {
    return new PageRequest(1, DEFAULT_SIZE);
  }

  /**
   * Row offset of this page.
   *
   * @return zero-based offset
   */
  public long offset() {
    return (long) (page - 1) * size;
  }
}
