package ca.gc.cra.nmapper.domain.snapshot;

import java.util.Locale;

/**
 * Classification of a {@link DeviceDiff}.
 *
 * @since 0.1.0
 */
public enum ChangeType {
  DEVICE_JOINED,
  DEVICE_LEFT,
  DEVICE_CHANGED,
  DEVICE_INACTIVE,
  PORT_OPENED,
  PORT_CLOSED,
  SERVICE_CHANGED,
  OS_CHANGED;

  /**
   * Returns the lowercase label, e.g. {@code device_joined}.
   *
   * @return wire label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
