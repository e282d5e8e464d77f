package ca.gc.cra.nmapper.application.port;

import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import java.time.Duration;
import java.util.List;

/**
 * <strong>What:</strong> External scan tool boundary returning a normalized device list.
 * <p><strong>Why:</strong> The scheduler treats scanning as an opaque, possibly slow and failing call.</p>
 * <p><strong>Role:</strong> Implemented by {@code CommandScannerAdapter} and {@code DisabledScannerAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent scans up to the scheduler ceiling.</p>
 * <p><strong>Cancellation:</strong> Implementations should return promptly with a {@link ScanException} or
 * {@link InterruptedException} when the calling thread is interrupted.</p>
 *
 * @since 0.1.0
 */
public interface ScannerPort {
  /**
   * Runs one scan.
   *
   * @param target validated target
   * @param profile scan profile
   * @param timeout upper bound for the scan
   * @return devices discovered by the scan; may be empty
   * @throws ScanException when the tool fails, times out or produces unusable output
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  List<Device> scan(ScanTarget target, ScanProfile profile, Duration timeout) throws InterruptedException;

  /**
   * Reports whether the scanner can currently run scans (binary present, not disabled).
   *
   * @return {@code true} when scans may succeed
   */
  boolean available();

  /**
   * Human-readable scanner description for health output.
   *
   * @return description such as the command name
   */
  String describe();
}
