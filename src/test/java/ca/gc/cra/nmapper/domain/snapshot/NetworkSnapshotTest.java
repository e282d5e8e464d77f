package ca.gc.cra.nmapper.domain.snapshot;

import static ca.gc.cra.nmapper.testing.Fixtures.T0;
import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nmapper.domain.network.Device;
import java.util.List;
import org.junit.jupiter.api.Test;

class NetworkSnapshotTest {

  @Test
  void createDerivesCountsAndChecksum() {
    NetworkSnapshot snapshot = NetworkSnapshot.create("s1", T0,
        List.of(device("10.0.0.1", 22, 80), device("10.0.0.2", 443)), null);

    assertEquals(2, snapshot.deviceCount());
    assertEquals(3, snapshot.totalPorts());
    assertTrue(snapshot.checksumMatches());
    assertEquals("unknown", snapshot.metadata().scanType());
  }

  @Test
  void checksumIgnoresDeviceOrder() {
    Device a = device("10.0.0.1", 22);
    Device b = device("10.0.0.10", 80);

    String forward = NetworkSnapshot.create("s1", T0, List.of(a, b), null).checksum();
    String reverse = NetworkSnapshot.create("s2", T0, List.of(b, a), null).checksum();

    assertEquals(forward, reverse);
  }

  @Test
  void checksumChangesWithPortState() {
    String before = SnapshotChecksum.of(List.of(device("10.0.0.1", 22)));
    String after = SnapshotChecksum.of(List.of(device("10.0.0.1", 22, 80)));

    assertFalse(before.equals(after));
  }

  @Test
  void mismatchedCountersAreRejected() {
    List<Device> devices = List.of(device("10.0.0.1", 22));
    String checksum = SnapshotChecksum.of(devices);

    assertThrows(IllegalArgumentException.class,
        () -> new NetworkSnapshot("s1", T0, 2, 1, checksum, devices, null));
    assertThrows(IllegalArgumentException.class,
        () -> new NetworkSnapshot("s1", T0, 1, 5, checksum, devices, null));
  }

  @Test
  void duplicateDeviceIpsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> NetworkSnapshot.create("s1", T0,
        List.of(device("10.0.0.1"), device("10.0.0.1", 22)), null));
  }

  @Test
  void tamperedDevicesFailChecksum() {
    NetworkSnapshot original = NetworkSnapshot.create("s1", T0, List.of(device("10.0.0.1", 22)), null);
    NetworkSnapshot tampered = new NetworkSnapshot("s1", T0, 1, 1, original.checksum(),
        List.of(device("10.0.0.1", 23)), null);

    assertFalse(tampered.checksumMatches());
  }

  @Test
  void diffSummaryMustAgreeWithEntries() {
    List<DeviceDiff> entries = List.of(DeviceDiff.joined(device("10.0.0.3")));

    assertThrows(IllegalArgumentException.class,
        () -> new SnapshotDiff("a", "b", T0, new DiffSummary(0, 1, 0, 0, 0), entries));
    SnapshotDiff derived = SnapshotDiff.of("a", "b", T0, entries);
    assertEquals(new DiffSummary(1, 0, 0, 0, 0), derived.summary());
    assertEquals(1, derived.summary().totalChanges());
  }
}
