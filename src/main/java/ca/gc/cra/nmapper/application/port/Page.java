package ca.gc.cra.nmapper.application.port;

import java.util.List;

/**
 * A page of results with the total match count.
 *
 * @param items items on this page
 * @param page one-based page number
 * @param size requested page size
 * @param total total number of matching items
 * @param <T> item type
 * @since 0.1.0
 */
public record Page<T>(List<T> items, int page, int size, long total) {

  public Page {
    items = items == null ? List.of() : List.copyOf(items);
  }

  /**
   * Number of pages needed to show {@link #total()} items.
   *
   * @return page count; zero when empty
   */
  public long totalPages() {
    return size == 0 ? 0 : (total + size - 1) / size;
  }

  /**
   * Indicates whether more pages follow this one.
   *
   * @return {@code true} when a next page exists
   */
  public boolean hasNext() {
    return page < totalPages();
  }
}
