package ca.gc.cra.nmapper.application.scheduling;

/**
 * Why a scan ran.
 *
 * @since 0.1.0
 */
public enum RunKind {
  /** Periodic occurrence of a registered schedule. */
  RECURRING,
  /** Extra run of a registered schedule requested with {@code runNow}. */
  ON_DEMAND,
  /** Ad hoc scan requested with {@code triggerManual}. */
  MANUAL
}
