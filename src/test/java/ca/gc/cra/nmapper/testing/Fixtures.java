package ca.gc.cra.nmapper.testing;

import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.network.Port;
import ca.gc.cra.nmapper.domain.network.Protocol;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotMetadata;
import java.time.Instant;
import java.util.List;

/** Small builders for inventories used across tests. */
public final class Fixtures {
  public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private Fixtures() {}

  public static Device device(String ip, int... openTcpPorts) {
    Device.Builder builder = Device.builder(ip).lastSeen(T0);
    for (int port : openTcpPorts) {
      builder.port(Port.open(port, Protocol.TCP));
    }
    return builder.build();
  }

  public static NetworkSnapshot snapshot(String id, Instant at, Device... devices) {
    return NetworkSnapshot.create(id, at, List.of(devices),
        new SnapshotMetadata(1_500L, "discovery", "10.0.0.0/24", List.of()));
  }

  public static NetworkSnapshot snapshot(String id, Device... devices) {
    return snapshot(id, T0, devices);
  }
}
