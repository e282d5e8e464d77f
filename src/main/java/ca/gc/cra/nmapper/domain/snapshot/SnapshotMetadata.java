package ca.gc.cra.nmapper.domain.snapshot;

import java.util.List;

/**
 * Scan provenance recorded alongside a snapshot.
 *
 * @param scanDurationMillis wall-clock scan duration in milliseconds; never negative
 * @param scanType scan profile label (e.g. {@code discovery})
 * @param scanTarget range that was scanned
 * @param errors non-fatal errors reported by the scanner
 * @since 0.1.0
 */
public record SnapshotMetadata(long scanDurationMillis, String scanType, String scanTarget, List<String> errors) {

  /**
   * Validates and copies metadata values.
   *
   * @throws IllegalArgumentException if {@code scanDurationMillis} is negative
   */
  public SnapshotMetadata {
    if (scanDurationMillis < 0) {
      throw new IllegalArgumentException("scanDurationMillis must not be negative");
    }
    scanType = scanType == null ? "unknown" : scanType;
    scanTarget = scanTarget == null ? "" : scanTarget;
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /**
   * Metadata for snapshots assembled outside a scan (tests, imports).
   *
   * @return empty metadata
   */
  public static SnapshotMetadata empty() {
    return new SnapshotMetadata(0L, "unknown", "", List.of());
  }
}
