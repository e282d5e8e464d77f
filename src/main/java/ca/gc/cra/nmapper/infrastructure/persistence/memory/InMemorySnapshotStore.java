package ca.gc.cra.nmapper.infrastructure.persistence.memory;

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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Map-backed snapshot store used by tests and by {@code storage.type: memory}. Contents are lost on exit.
 *
 * @since 0.1.0
 */
public final class InMemorySnapshotStore implements SnapshotStorePort {
  private final Map<String, NetworkSnapshot> snapshots = new LinkedHashMap<>();
  private final Map<String, StoredDiff> diffs = new LinkedHashMap<>();

  @Override
  public void initialize() {
    // nothing to open
  }

  @Override
  public synchronized String create(NetworkSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    if (!snapshot.checksumMatches()) {
      throw new ValidationException("snapshot " + snapshot.id() + " checksum does not match its devices");
    }
    if (snapshots.containsKey(snapshot.id())) {
      throw new ConflictException("snapshot " + snapshot.id() + " already exists");
    }
    snapshots.put(snapshot.id(), snapshot);
    return snapshot.id();
  }

  @Override
  public synchronized NetworkSnapshot getById(String id) {
    NetworkSnapshot snapshot = snapshots.get(id);
    if (snapshot == null) {
      throw new NotFoundException("snapshot not found: " + id);
    }
    return snapshot;
  }

  @Override
  public synchronized Optional<NetworkSnapshot> getLatest() {
    return snapshots.values().stream()
        .max(Comparator.comparing(NetworkSnapshot::timestamp).thenComparing(NetworkSnapshot::id));
  }

  @Override
  public synchronized Page<NetworkSnapshot> list(SnapshotQuery query, PageRequest page) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(page, "page");
    Comparator<NetworkSnapshot> order = switch (query.sortBy()) {
      case TIMESTAMP -> Comparator.comparing(NetworkSnapshot::timestamp);
      case DEVICE_COUNT -> Comparator.comparingInt(NetworkSnapshot::deviceCount);
      case TOTAL_PORTS -> Comparator.comparingInt(NetworkSnapshot::totalPorts);
    };
    order = order.thenComparing(NetworkSnapshot::id);
    if (query.descending()) {
      order = order.reversed();
    }
    List<NetworkSnapshot> matching = snapshots.values().stream()
        .filter(s -> query.startDate() == null || !s.timestamp().isBefore(query.startDate()))
        .filter(s -> query.endDate() == null || !s.timestamp().isAfter(query.endDate()))
        .filter(s -> query.deviceIp() == null || s.device(query.deviceIp().trim()).isPresent())
        .sorted(order)
        .collect(Collectors.toList());
    int from = (int) Math.min(page.offset(), matching.size());
    int to = Math.min(from + page.size(), matching.size());
    return new Page<>(matching.subList(from, to), page.page(), page.size(), matching.size());
  }

  @Override
  public synchronized String createDiff(SnapshotDiff diff) {
    Objects.requireNonNull(diff, "diff");
    if (diff.comparesSameSnapshot()) {
      throw new ValidationException("a diff must compare two different snapshots");
    }
    getById(diff.fromSnapshot());
    getById(diff.toSnapshot());
    String key = pairKey(diff.fromSnapshot(), diff.toSnapshot());
    StoredDiff existing = diffs.get(key);
    if (existing != null) {
      return existing.id();
    }
    String id = UUID.randomUUID().toString();
    diffs.put(key, new StoredDiff(id, diff));
    return id;
  }

  @Override
  public synchronized Optional<SnapshotDiff> getDiff(String fromId, String toId) {
    return Optional.ofNullable(diffs.get(pairKey(fromId, toId))).map(StoredDiff::diff);
  }

  @Override
  public synchronized List<SnapshotDiff> listRecentDiffs(Instant since) {
    Objects.requireNonNull(since, "since");
    return diffs.values().stream()
        .map(StoredDiff::diff)
        .filter(d -> !d.timestamp().isBefore(since))
        .sorted(Comparator.comparing(SnapshotDiff::timestamp)
            .thenComparing(SnapshotDiff::fromSnapshot)
            .thenComparing(SnapshotDiff::toSnapshot))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized void delete(String id) {
    if (snapshots.remove(id) == null) {
      throw new NotFoundException("snapshot not found: " + id);
    }
    diffs.values().removeIf(d -> d.diff().fromSnapshot().equals(id) || d.diff().toSnapshot().equals(id));
  }

  @Override
  public synchronized int deleteOlderThan(Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    List<String> expired = new ArrayList<>();
    for (NetworkSnapshot snapshot : snapshots.values()) {
      if (snapshot.timestamp().isBefore(cutoff)) {
        expired.add(snapshot.id());
      }
    }
    expired.forEach(this::delete);
    return expired.size();
  }

  @Override
  public synchronized List<ScanStatistics> statistics() {
    Map<String, List<NetworkSnapshot>> byType = new TreeMap<>();
    for (NetworkSnapshot snapshot : snapshots.values()) {
      byType.computeIfAbsent(snapshot.metadata().scanType(), k -> new ArrayList<>()).add(snapshot);
    }
    List<ScanStatistics> result = new ArrayList<>();
    byType.forEach((type, group) -> result.add(new ScanStatistics(
        type,
        group.size(),
        group.stream().mapToInt(NetworkSnapshot::deviceCount).average().orElse(0),
        group.stream().mapToInt(NetworkSnapshot::deviceCount).max().orElse(0),
        group.stream().mapToLong(s -> s.metadata().scanDurationMillis()).average().orElse(0),
        group.stream().map(NetworkSnapshot::timestamp).max(Comparator.naturalOrder()).orElse(null))));
    return result;
  }

  @Override
  public void ping() {
    // always reachable
  }

  @Override
  public void close() {
    // contents survive close so a restarted orchestrator sees them
  }

  /**
   * Number of stored diffs.
   *
   * @return diff count
   */
  public synchronized int diffCount() {
    return diffs.size();
  }

  private static String pairKey(String fromId, String toId) {
    return fromId + "\u0000" + toId;
  }

  private record StoredDiff(String id, SnapshotDiff diff) {}
}
