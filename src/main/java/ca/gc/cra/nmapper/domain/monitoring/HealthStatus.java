package ca.gc.cra.nmapper.domain.monitoring;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate health of the orchestrator.
 *
 * @param status overall level derived from {@code components}
 * @param timestamp time of the last health computation
 * @param components per-component probe results
 * @since 0.1.0
 */
public record HealthStatus(Level status, Instant timestamp, List<ComponentHealth> components) {

  public HealthStatus {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(timestamp, "timestamp");
    components = components == null ? List.of() : List.copyOf(components);
  }

  /**
   * Derives the overall level: healthy when every component is healthy, degraded when at least one is,
   * unhealthy otherwise.
   *
   * @param timestamp computation time
   * @param components probe results
   * @return aggregate status
   */
  public static HealthStatus of(Instant timestamp, List<ComponentHealth> components) {
    long healthy = components.stream().filter(ComponentHealth::healthy).count();
    Level level;
    if (!components.isEmpty() && healthy == components.size()) {
      level = Level.HEALTHY;
    } else if (healthy > 0) {
      level = Level.DEGRADED;
    } else {
      level = Level.UNHEALTHY;
    }
    return new HealthStatus(level, timestamp, components);
  }

  /**
   * Finds a component by name.
   *
   * @param name component name
   * @return matching component, if present
   */
  public Optional<ComponentHealth> component(String name) {
    return components.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  /** Overall health levels. */
  public enum Level {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
  }
}
