package ca.gc.cra.nmapper.application.port;

import ca.gc.cra.nmapper.domain.error.ValidationException;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Filter and ordering for snapshot listings. Every field is optional.
 *
 * @param startDate inclusive lower bound on snapshot timestamp
 * @param endDate inclusive upper bound on snapshot timestamp
 * @param deviceIp only snapshots containing this device IP
 * @param sortBy sort column; defaults to {@link SortField#TIMESTAMP}
 * @param descending sort direction; newest first by default
 * @since 0.1.0
 */
public record SnapshotQuery(
    Instant startDate, Instant endDate, String deviceIp, SortField sortBy, boolean descending) {

  /**
   * Validates the date window.
   *
   * @throws ValidationException if {@code startDate} is after {@code endDate}
   */
  public SnapshotQuery {
    sortBy = Objects.requireNonNullElse(sortBy, SortField.TIMESTAMP);
    if (deviceIp != null && deviceIp.isBlank()) {
      deviceIp = null;
    }
    if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
      throw new ValidationException("startDate must not be after endDate");
    }
  }

  /**
   * Unfiltered query, newest first.
   *
   * @return default query
   */
  public static SnapshotQuery all() {
    return new SnapshotQuery(null, null, null, SortField.TIMESTAMP, true);
  }

  /** Sortable snapshot columns. */
  public enum SortField {
    TIMESTAMP,
    DEVICE_COUNT,
    TOTAL_PORTS;

    /**
     * Parses a sort label such as {@code deviceCount} or {@code total_ports}.
     *
     * @param raw label; blank resolves to {@link #TIMESTAMP}
     * @return parsed field
     * @throws ValidationException if the label is unknown
     */
    public static SortField from(String raw) {
      if (raw == null || raw.isBlank()) {
        return TIMESTAMP;
      }
      String normalized = raw.trim().replace("_", "").toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "timestamp" -> TIMESTAMP;
        case "devicecount" -> DEVICE_COUNT;
        case "totalports" -> TOTAL_PORTS;
        default -> throw new ValidationException("sortBy must be timestamp, deviceCount or totalPorts");
      };
    }
  }
}
