package ca.gc.cra.nmapper.infrastructure.scanner;

import ca.gc.cra.nmapper.application.port.ScannerPort;
import ca.gc.cra.nmapper.domain.error.ScanException;
import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import java.time.Duration;
import java.util.List;

/**
 * Scanner used when no scan command is configured ({@code scanner.command} empty). Every scan fails without
 * retries so the monitor can still serve stored snapshots.
 *
 * @since 0.1.0
 */
public final class DisabledScannerAdapter implements ScannerPort {

  @Override
  public List<Device> scan(ScanTarget target, ScanProfile profile, Duration timeout) {
    throw new ScanException("scanner not configured; set scanner.command", null, false);
  }

  @Override
  public boolean available() {
    return false;
  }

  @Override
  public String describe() {
    return "disabled";
  }
}
