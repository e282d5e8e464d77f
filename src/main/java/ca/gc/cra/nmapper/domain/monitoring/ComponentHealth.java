package ca.gc.cra.nmapper.domain.monitoring;

import java.time.Instant;
import java.util.Objects;

/**
 * Health probe result for one component.
 *
 * @param name component name (e.g. {@code storage})
 * @param healthy whether the probe succeeded
 * @param status short status label ({@code ok}, {@code degraded}, {@code down})
 * @param lastCheck probe time
 * @param message optional detail; {@code null} when healthy
 * @since 0.1.0
 */
public record ComponentHealth(String name, boolean healthy, String status, Instant lastCheck, String message) {

  public ComponentHealth {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(lastCheck, "lastCheck");
  }

  public static ComponentHealth up(String name, Instant at) {
    return new ComponentHealth(name, true, "ok", at, null);
  }

  public static ComponentHealth up(String name, Instant at, String message) {
    return new ComponentHealth(name, true, "ok", at, message);
  }

  public static ComponentHealth down(String name, Instant at, String message) {
    return new ComponentHealth(name, false, "down", at, message);
  }
}
