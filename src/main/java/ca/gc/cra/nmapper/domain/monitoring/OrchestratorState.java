package ca.gc.cra.nmapper.domain.monitoring;

/**
 * Lifecycle states of the monitoring orchestrator.
 *
 * <p>Normal flow is {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}; {@code ERROR} is reachable
 * from any transition and left only through {@code restart()}.</p>
 *
 * @since 0.1.0
 */
public enum OrchestratorState {
  STOPPED,
  STARTING,
  RUNNING,
  STOPPING,
  ERROR;

  /**
   * Indicates a transition is in progress.
   *
   * @return {@code true} for {@link #STARTING} and {@link #STOPPING}
   */
  public boolean transitioning() {
    return this == STARTING || this == STOPPING;
  }
}
