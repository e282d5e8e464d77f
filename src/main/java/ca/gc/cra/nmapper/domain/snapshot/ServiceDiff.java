package ca.gc.cra.nmapper.domain.snapshot;

import ca.gc.cra.nmapper.domain.network.Protocol;
import ca.gc.cra.nmapper.domain.network.Service;
import java.util.Objects;

/**
 * Change to the service detected on a port.
 *
 * @param port port number
 * @param protocol transport protocol
 * @param changeType kind of change
 * @param oldService service before; {@code null} for {@link Kind#ADDED}
 * @param newService service after; {@code null} for {@link Kind#REMOVED}
 * @since 0.1.0
 */
public record ServiceDiff(int port, Protocol protocol, Kind changeType, Service oldService, Service newService) {

  public ServiceDiff {
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(changeType, "changeType");
  }

  /** Service change kinds. Name, product or version differences are reported as {@link #VERSION_CHANGED}. */
  public enum Kind {
    ADDED,
    REMOVED,
    VERSION_CHANGED
  }
}
