package ca.gc.cra.nmapper.domain.snapshot;

import ca.gc.cra.nmapper.domain.network.PortState;
import ca.gc.cra.nmapper.domain.network.Protocol;
import java.util.Objects;

/**
 * Change to a single {@code (number, protocol)} port on a device.
 *
 * @param port port number
 * @param protocol transport protocol
 * @param changeType kind of change
 * @param oldState state before; {@code null} for {@link Kind#ADDED}
 * @param newState state after; {@code null} for {@link Kind#REMOVED}
 * @since 0.1.0
 */
public record PortDiff(int port, Protocol protocol, Kind changeType, PortState oldState, PortState newState) {

  public PortDiff {
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(changeType, "changeType");
  }

  /** Port change kinds. */
  public enum Kind {
    ADDED,
    REMOVED,
    STATE_CHANGED
  }
}
