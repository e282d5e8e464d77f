package ca.gc.cra.nmapper.domain.snapshot;

import java.util.Objects;

/**
 * Scalar property change on a device, e.g. {@code hostname} or {@code osInfo.family}.
 *
 * @param property dotted property name
 * @param oldValue previous value rendered as text; {@code null} when absent
 * @param newValue new value rendered as text; {@code null} when absent
 * @since 0.1.0
 */
public record PropertyChange(String property, String oldValue, String newValue) {

  public PropertyChange {
    Objects.requireNonNull(property, "property");
  }
}
