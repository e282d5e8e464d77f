package ca.gc.cra.nmapper.infrastructure.persistence;

import static ca.gc.cra.nmapper.testing.Fixtures.T0;
import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static ca.gc.cra.nmapper.testing.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nmapper.application.diff.SnapshotDiffEngine;
import ca.gc.cra.nmapper.application.port.Page;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.ScanStatistics;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.application.port.SnapshotStorePort;
import ca.gc.cra.nmapper.domain.error.ConflictException;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotMetadata;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behaviour every {@link SnapshotStorePort} implementation shares. */
public abstract class SnapshotStoreContract {
  private final SnapshotDiffEngine engine = new SnapshotDiffEngine();
  protected SnapshotStorePort store;

  protected abstract SnapshotStorePort newStore();

  @BeforeEach
  void openStore() {
    store = newStore();
    store.initialize();
  }

  @AfterEach
  void closeStore() {
    store.close();
  }

  @Test
  void storesAndLoadsSnapshots() {
    NetworkSnapshot original = snapshot("s1", device("10.0.0.1", 22, 443), device("10.0.0.2"));

    assertEquals("s1", store.create(original));
    NetworkSnapshot loaded = store.getById("s1");

    assertEquals(original.timestamp(), loaded.timestamp());
    assertEquals(2, loaded.deviceCount());
    assertEquals(2, loaded.totalPorts());
    assertEquals(original.checksum(), loaded.checksum());
    assertTrue(loaded.checksumMatches());
    assertEquals("discovery", loaded.metadata().scanType());
    assertEquals(List.of(22, 443), loaded.device("10.0.0.1").orElseThrow().ports().stream()
        .map(p -> p.number()).collect(Collectors.toList()));
  }

  @Test
  void duplicateIdsConflict() {
    store.create(snapshot("s1", device("10.0.0.1")));

    assertThrows(ConflictException.class, () -> store.create(snapshot("s1", device("10.0.0.9"))));
  }

  @Test
  void missingSnapshotsAreNotFound() {
    assertThrows(NotFoundException.class, () -> store.getById("nope"));
    assertThrows(NotFoundException.class, () -> store.delete("nope"));
    assertTrue(store.getLatest().isEmpty());
  }

  @Test
  void latestIsNewestByTimestamp() {
    store.create(snapshot("b", T0, device("10.0.0.1")));
    store.create(snapshot("a", T0.plusSeconds(30), device("10.0.0.1")));
    store.create(snapshot("c", T0.minusSeconds(30), device("10.0.0.1")));

    assertEquals("a", store.getLatest().orElseThrow().id());
  }

  @Test
  void listFiltersSortsAndPages() {
    for (int i = 0; i < 7; i++) {
      NetworkSnapshot s = i % 2 == 0
          ? snapshot("s" + i, T0.plusSeconds(i * 60L), device("10.0.0.1"), device("10.0.0.50"))
          : snapshot("s" + i, T0.plusSeconds(i * 60L), device("10.0.0.1"));
      store.create(s);
    }

    Page<NetworkSnapshot> first = store.list(SnapshotQuery.all(), new PageRequest(1, 5));
    assertEquals(7, first.total());
    assertEquals(2, first.totalPages());
    assertTrue(first.hasNext());
    assertEquals(List.of("s6", "s5", "s4", "s3", "s2"), ids(first));
    assertEquals(List.of("s1", "s0"), ids(store.list(SnapshotQuery.all(), new PageRequest(2, 5))));

    SnapshotQuery window = new SnapshotQuery(T0.plusSeconds(60), T0.plusSeconds(180), null,
        SnapshotQuery.SortField.TIMESTAMP, false);
    assertEquals(List.of("s1", "s2", "s3"), ids(store.list(window, PageRequest.first())));

    SnapshotQuery withDevice = new SnapshotQuery(null, null, "10.0.0.50", SnapshotQuery.SortField.TIMESTAMP, false);
    assertEquals(List.of("s0", "s2", "s4", "s6"), ids(store.list(withDevice, PageRequest.first())));

    SnapshotQuery bySize = new SnapshotQuery(null, null, null, SnapshotQuery.SortField.DEVICE_COUNT, true);
    assertEquals(2, store.list(bySize, new PageRequest(1, 5)).items().get(0).deviceCount());
  }

  @Test
  void diffsAreStoredOncePerPair() {
    NetworkSnapshot from = snapshot("s1", T0, device("10.0.0.1", 22));
    NetworkSnapshot to = snapshot("s2", T0.plusSeconds(300), device("10.0.0.1", 22, 80));
    store.create(from);
    store.create(to);
    SnapshotDiff diff = engine.diff(from, to);

    String id = store.createDiff(diff);
    assertEquals(id, store.createDiff(diff));

    SnapshotDiff loaded = store.getDiff("s1", "s2").orElseThrow();
    assertEquals(diff.summary(), loaded.summary());
    assertEquals(diff.timestamp(), loaded.timestamp());
    assertTrue(store.getDiff("s2", "s1").isEmpty());
  }

  @Test
  void diffsNeedTwoExistingSnapshots() {
    NetworkSnapshot from = snapshot("s1", device("10.0.0.1"));
    NetworkSnapshot to = snapshot("s2", T0.plusSeconds(60), device("10.0.0.2"));
    store.create(from);

    assertThrows(NotFoundException.class, () -> store.createDiff(engine.diff(from, to)));
    assertThrows(ValidationException.class, () -> store.createDiff(engine.diff(from, from)));
  }

  @Test
  void recentDiffsAreFilteredByTime() {
    NetworkSnapshot a = snapshot("a", T0, device("10.0.0.1"));
    NetworkSnapshot b = snapshot("b", T0.plus(Duration.ofHours(2)), device("10.0.0.1"), device("10.0.0.2"));
    NetworkSnapshot c = snapshot("c", T0.plus(Duration.ofHours(4)), device("10.0.0.2"));
    store.create(a);
    store.create(b);
    store.create(c);
    store.createDiff(engine.diff(a, b));
    store.createDiff(engine.diff(b, c));

    List<SnapshotDiff> recent = store.listRecentDiffs(T0.plus(Duration.ofHours(3)));
    assertEquals(1, recent.size());
    assertEquals("c", recent.get(0).toSnapshot());
    assertEquals(2, store.listRecentDiffs(T0).size());
  }

  @Test
  void recentDiffsWithTheSameTimestampAreOrderedBySnapshotPair() {
    NetworkSnapshot a = snapshot("a", T0, device("10.0.0.1"));
    NetworkSnapshot b = snapshot("b", T0.plus(Duration.ofHours(1)), device("10.0.0.2"));
    NetworkSnapshot c = snapshot("c", T0.plus(Duration.ofHours(2)), device("10.0.0.3"));
    store.create(a);
    store.create(b);
    store.create(c);
    store.createDiff(engine.diff(b, c));
    store.createDiff(engine.diff(a, c));

    List<String> pairs = store.listRecentDiffs(T0).stream()
        .map(d -> d.fromSnapshot() + ">" + d.toSnapshot())
        .collect(Collectors.toList());

    assertEquals(List.of("a>c", "b>c"), pairs);
  }

  @Test
  void deletingSnapshotsRemovesTheirDiffs() {
    NetworkSnapshot a = snapshot("a", T0.minus(Duration.ofDays(40)), device("10.0.0.1"));
    NetworkSnapshot b = snapshot("b", T0.minus(Duration.ofDays(35)), device("10.0.0.1", 22));
    NetworkSnapshot c = snapshot("c", T0, device("10.0.0.1", 22));
    store.create(a);
    store.create(b);
    store.create(c);
    store.createDiff(engine.diff(a, b));
    store.createDiff(engine.diff(b, c));

    assertEquals(2, store.deleteOlderThan(T0.minus(Duration.ofDays(30))));
    assertTrue(store.listRecentDiffs(T0.minus(Duration.ofDays(365))).isEmpty());
    assertEquals("c", store.getLatest().orElseThrow().id());

    store.delete("c");
    assertTrue(store.getLatest().isEmpty());
    assertEquals(0, store.deleteOlderThan(T0));
  }

  @Test
  void statisticsAggregatePerScanType() {
    store.create(snapshot("d1", T0, device("10.0.0.1")));
    store.create(snapshot("d2", T0.plusSeconds(60), device("10.0.0.1"), device("10.0.0.2"), device("10.0.0.3")));
    store.create(NetworkSnapshot.create("q1", T0.plusSeconds(120), List.of(device("10.0.0.1")),
        new SnapshotMetadata(400L, "quick", "10.0.0.1", List.of())));

    List<ScanStatistics> stats = store.statistics();

    assertEquals(List.of("discovery", "quick"), stats.stream().map(ScanStatistics::scanType).toList());
    ScanStatistics discovery = stats.get(0);
    assertEquals(2, discovery.scans());
    assertEquals(2.0, discovery.averageDevices(), 0.001);
    assertEquals(3, discovery.maxDevices());
    assertEquals(1_500.0, discovery.averageScanDurationMillis(), 0.001);
    assertEquals(T0.plusSeconds(60), discovery.lastScanAt());
    assertEquals(T0.plusSeconds(120), stats.get(1).lastScanAt());
  }

  @Test
  void emptyStoreHasNoStatistics() {
    assertTrue(store.statistics().isEmpty());
    store.ping();
    assertNull(store.getLatest().orElse(null));
  }

  private static List<String> ids(Page<NetworkSnapshot> page) {
    return page.items().stream().map(NetworkSnapshot::id).collect(Collectors.toList());
  }
}
