package ca.gc.cra.nmapper.infrastructure.persistence.jdbc;

import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.Page;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.ScanStatistics;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.application.port.SnapshotStorePort;
import ca.gc.cra.nmapper.domain.error.ConflictException;
import ca.gc.cra.nmapper.domain.error.InfrastructureException;
import ca.gc.cra.nmapper.domain.error.NotFoundException;
import ca.gc.cra.nmapper.domain.error.ValidationException;
import ca.gc.cra.nmapper.domain.network.Device;
import ca.gc.cra.nmapper.domain.snapshot.DiffSummary;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotMetadata;
import ca.gc.cra.nmapper.infrastructure.json.JsonCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SnapshotStorePort} over plain JDBC (PostgreSQL in production, H2 in tests).
 * <p><strong>Layout:</strong> {@code network_snapshots} keeps counts, checksum and scan provenance as columns and
 * the device list as JSON; {@code snapshot_devices} indexes device IPs for filtering; {@code snapshot_diffs}
 * keeps summary counts as columns and the full diff as JSON, unique per ordered snapshot pair.</p>
 * <p><strong>Errors:</strong> connection-class SQL states ({@code 08xxx}) and transient exceptions drop the
 * connection and raise a retryable {@link InfrastructureException}; the next call reconnects. Other SQL failures
 * raise a non-retryable one.</p>
 * <p><strong>Thread-safety:</strong> One connection guarded by a lock; each operation runs in its own
 * transaction.</p>
 *
 * @since 0.1.0
 */
public final class JdbcSnapshotStore implements SnapshotStorePort {
  private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);
  private static final TypeReference<List<Device>> DEVICE_LIST = new TypeReference<>() {};
  private static final String UNIQUE_VIOLATION = "23505";

  private static final String SNAPSHOT_COLUMNS =
      "s.id, s.taken_at, s.device_count, s.total_ports, s.checksum, s.metadata, s.devices";

  /** Opens new physical connections. */
  @FunctionalInterface
  public interface ConnectionFactory {
    /**
     * Opens a connection.
     *
     * @return new connection
     * @throws SQLException if the database cannot be reached
     */
    Connection open() throws SQLException;
  }

  private final ConnectionFactory connections;
  private final JsonCodec json;
  private final MetricsPort metrics;
  private final SchemaMigrator migrator;
  private final ReentrantLock lock = new ReentrantLock();
  private Connection connection;

  /**
   * Creates a store using {@link DriverManager}.
   *
   * @param url JDBC url
   * @param user database user; may be {@code null}
   * @param password database password; may be {@code null}
   * @param json JSON codec for device and diff payloads
   * @param metrics metrics sink
   */
  public JdbcSnapshotStore(String url, String user, String password, JsonCodec json, MetricsPort metrics) {
    this(() -> DriverManager.getConnection(Objects.requireNonNull(url, "url"), user, password),
        json, metrics, new SchemaMigrator());
  }

  JdbcSnapshotStore(ConnectionFactory connections, JsonCodec json, MetricsPort metrics, SchemaMigrator migrator) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.migrator = Objects.requireNonNull(migrator, "migrator");
  }

  @Override
  public void initialize() {
    lock.lock();
    try {
      Connection c = connection();
      migrator.migrate(c);
    } catch (SQLException ex) {
      throw translate("initialize", ex);
    } finally {
      lock.unlock();
    }
    log.info("Snapshot store initialized");
  }

  @Override
  public String create(NetworkSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    if (!snapshot.checksumMatches()) {
      throw new ValidationException("snapshot " + snapshot.id() + " checksum does not match its devices");
    }
    inTransaction("create", c -> {
      try (PreparedStatement insert = c.prepareStatement(
          "INSERT INTO network_snapshots (id, taken_at, device_count, total_ports, checksum, scan_duration_ms, "
              + "scan_type, scan_target, metadata, devices, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
        insert.setString(1, snapshot.id());
        insert.setObject(2, toOffset(snapshot.timestamp()));
        insert.setInt(3, snapshot.deviceCount());
        insert.setInt(4, snapshot.totalPorts());
        insert.setString(5, snapshot.checksum());
        insert.setLong(6, snapshot.metadata().scanDurationMillis());
        insert.setString(7, snapshot.metadata().scanType());
        insert.setString(8, snapshot.metadata().scanTarget());
        insert.setString(9, json.write(snapshot.metadata()));
        insert.setString(10, json.write(snapshot.devices()));
        insert.setObject(11, OffsetDateTime.now(ZoneOffset.UTC));
        insert.executeUpdate();
      } catch (SQLException ex) {
        if (UNIQUE_VIOLATION.equals(ex.getSQLState())) {
          throw new ConflictException("snapshot " + snapshot.id() + " already exists", ex);
        }
        throw ex;
      }
      try (PreparedStatement index = c.prepareStatement(
          "INSERT INTO snapshot_devices (snapshot_id, ip, mac, hostname) VALUES (?, ?, ?, ?)")) {
        for (Device device : snapshot.devices()) {
          index.setString(1, snapshot.id());
          index.setString(2, device.ip());
          index.setString(3, device.mac());
          index.setString(4, device.hostname());
          index.addBatch();
        }
        if (!snapshot.devices().isEmpty()) {
          index.executeBatch();
        }
      }
      return null;
    });
    metrics.increment("store.snapshot.created");
    log.debug("Stored snapshot {} ({} devices)", snapshot.id(), snapshot.deviceCount());
    return snapshot.id();
  }

  @Override
  public NetworkSnapshot getById(String id) {
    return findSnapshot(id).orElseThrow(() -> new NotFoundException("snapshot not found: " + id));
  }

  @Override
  public Optional<NetworkSnapshot> getLatest() {
    return inTransaction("getLatest", c -> {
      try (PreparedStatement query = c.prepareStatement(
          "SELECT " + SNAPSHOT_COLUMNS + " FROM network_snapshots s ORDER BY s.taken_at DESC, s.id DESC LIMIT 1");
          ResultSet rows = query.executeQuery()) {
        return rows.next() ? Optional.of(readSnapshot(rows)) : Optional.<NetworkSnapshot>empty();
      }
    });
  }

  @Override
  public Page<NetworkSnapshot> list(SnapshotQuery query, PageRequest page) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(page, "page");
    StringBuilder where = new StringBuilder(" WHERE 1 = 1");
    List<Object> params = new ArrayList<>();
    if (query.startDate() != null) {
      where.append(" AND s.taken_at >= ?");
      params.add(toOffset(query.startDate()));
    }
    if (query.endDate() != null) {
      where.append(" AND s.taken_at <= ?");
      params.add(toOffset(query.endDate()));
    }
    if (query.deviceIp() != null) {
      where.append(" AND EXISTS (SELECT 1 FROM snapshot_devices d WHERE d.snapshot_id = s.id AND d.ip = ?)");
      params.add(query.deviceIp().trim());
    }
    String direction = query.descending() ? " DESC" : " ASC";
    String order = " ORDER BY " + sortColumn(query.sortBy()) + direction + ", s.id" + direction;

    return inTransaction("list", c -> {
      long total;
      try (PreparedStatement count = c.prepareStatement("SELECT COUNT(*) FROM network_snapshots s" + where)) {
        bind(count, params);
        try (ResultSet rows = count.executeQuery()) {
          rows.next();
          total = rows.getLong(1);
        }
      }
      List<NetworkSnapshot> items = new ArrayList<>();
      try (PreparedStatement select = c.prepareStatement(
          "SELECT " + SNAPSHOT_COLUMNS + " FROM network_snapshots s" + where + order + " LIMIT ? OFFSET ?")) {
        bind(select, params);
        select.setInt(params.size() + 1, page.size());
        select.setLong(params.size() + 2, page.offset());
        try (ResultSet rows = select.executeQuery()) {
          while (rows.next()) {
            items.add(readSnapshot(rows));
          }
        }
      }
      return new Page<>(items, page.page(), page.size(), total);
    });
  }

  @Override
  public String createDiff(SnapshotDiff diff) {
    Objects.requireNonNull(diff, "diff");
    if (diff.comparesSameSnapshot()) {
      throw new ValidationException("a diff must compare two different snapshots");
    }
    String created = inTransaction("createDiff", c -> {
      requireSnapshot(c, diff.fromSnapshot());
      requireSnapshot(c, diff.toSnapshot());
      Optional<String> existing = findDiffId(c, diff.fromSnapshot(), diff.toSnapshot());
      if (existing.isPresent()) {
        return existing.get();
      }
      String id = UUID.randomUUID().toString();
      DiffSummary summary = diff.summary();
      try (PreparedStatement insert = c.prepareStatement(
          "INSERT INTO snapshot_diffs (id, from_snapshot_id, to_snapshot_id, computed_at, devices_added, "
              + "devices_removed, devices_changed, ports_changed, services_changed, total_changes, diff_data, "
              + "created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
        insert.setString(1, id);
        insert.setString(2, diff.fromSnapshot());
        insert.setString(3, diff.toSnapshot());
        insert.setObject(4, toOffset(diff.timestamp()));
        insert.setInt(5, summary.devicesAdded());
        insert.setInt(6, summary.devicesRemoved());
        insert.setInt(7, summary.devicesChanged());
        insert.setInt(8, summary.portsChanged());
        insert.setInt(9, summary.servicesChanged());
        insert.setInt(10, summary.totalChanges());
        insert.setString(11, json.write(diff));
        insert.setObject(12, OffsetDateTime.now(ZoneOffset.UTC));
        insert.executeUpdate();
      } catch (SQLException ex) {
        if (UNIQUE_VIOLATION.equals(ex.getSQLState())) {
          return null;
        }
        throw ex;
      }
      return id;
    });
    if (created == null) {
      // Lost a race with a concurrent writer for the same pair; the stored row wins.
      metrics.increment("store.diff.duplicate");
      return inTransaction("createDiff", c -> findDiffId(c, diff.fromSnapshot(), diff.toSnapshot())
          .orElseThrow(() -> new InfrastructureException("diff vanished after conflict", null, true)));
    }
    metrics.increment("store.diff.created");
    return created;
  }

  @Override
  public Optional<SnapshotDiff> getDiff(String fromId, String toId) {
    return inTransaction("getDiff", c -> {
      try (PreparedStatement query = c.prepareStatement(
          "SELECT diff_data FROM snapshot_diffs WHERE from_snapshot_id = ? AND to_snapshot_id = ?")) {
        query.setString(1, fromId);
        query.setString(2, toId);
        try (ResultSet rows = query.executeQuery()) {
          return rows.next() ? Optional.of(readDiff(rows.getString(1))) : Optional.<SnapshotDiff>empty();
        }
      }
    });
  }

  @Override
  public List<SnapshotDiff> listRecentDiffs(Instant since) {
    Objects.requireNonNull(since, "since");
    return inTransaction("listRecentDiffs", c -> {
      try (PreparedStatement query = c.prepareStatement(
          "SELECT diff_data FROM snapshot_diffs WHERE computed_at >= ? "
              + "ORDER BY computed_at, from_snapshot_id, to_snapshot_id")) {
        query.setObject(1, toOffset(since));
        List<SnapshotDiff> diffs = new ArrayList<>();
        try (ResultSet rows = query.executeQuery()) {
          while (rows.next()) {
            diffs.add(readDiff(rows.getString(1)));
          }
        }
        return diffs;
      }
    });
  }

  @Override
  public void delete(String id) {
    int deleted = inTransaction("delete", c -> {
      try (PreparedStatement diffs = c.prepareStatement(
              "DELETE FROM snapshot_diffs WHERE from_snapshot_id = ? OR to_snapshot_id = ?");
          PreparedStatement devices = c.prepareStatement("DELETE FROM snapshot_devices WHERE snapshot_id = ?");
          PreparedStatement snapshots = c.prepareStatement("DELETE FROM network_snapshots WHERE id = ?")) {
        diffs.setString(1, id);
        diffs.setString(2, id);
        diffs.executeUpdate();
        devices.setString(1, id);
        devices.executeUpdate();
        snapshots.setString(1, id);
        return snapshots.executeUpdate();
      }
    });
    if (deleted == 0) {
      throw new NotFoundException("snapshot not found: " + id);
    }
    metrics.increment("store.snapshot.deleted");
  }

  @Override
  public int deleteOlderThan(Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    OffsetDateTime bound = toOffset(cutoff);
    int deleted = inTransaction("deleteOlderThan", c -> {
      String old = "SELECT id FROM network_snapshots WHERE taken_at < ?";
      try (PreparedStatement diffs = c.prepareStatement(
              "DELETE FROM snapshot_diffs WHERE from_snapshot_id IN (" + old + ") OR to_snapshot_id IN (" + old + ")");
          PreparedStatement devices = c.prepareStatement(
              "DELETE FROM snapshot_devices WHERE snapshot_id IN (" + old + ")");
          PreparedStatement snapshots = c.prepareStatement("DELETE FROM network_snapshots WHERE taken_at < ?")) {
        diffs.setObject(1, bound);
        diffs.setObject(2, bound);
        diffs.executeUpdate();
        devices.setObject(1, bound);
        devices.executeUpdate();
        snapshots.setObject(1, bound);
        return snapshots.executeUpdate();
      }
    });
    metrics.observe("store.snapshot.expired", deleted);
    return deleted;
  }

  @Override
  public List<ScanStatistics> statistics() {
    return inTransaction("statistics", c -> {
      try (Statement statement = c.createStatement();
          ResultSet rows = statement.executeQuery(
              "SELECT scan_type, scans_count, avg_devices, max_devices, avg_scan_duration_ms, last_scan_at "
                  + "FROM scan_statistics ORDER BY scan_type")) {
        List<ScanStatistics> result = new ArrayList<>();
        while (rows.next()) {
          OffsetDateTime last = rows.getObject(6, OffsetDateTime.class);
          result.add(new ScanStatistics(rows.getString(1), rows.getLong(2), rows.getDouble(3), rows.getInt(4),
              rows.getDouble(5), last == null ? null : last.toInstant()));
        }
        return result;
      }
    });
  }

  @Override
  public void ping() {
    inTransaction("ping", c -> {
      try (Statement statement = c.createStatement(); ResultSet rows = statement.executeQuery("SELECT 1")) {
        rows.next();
        return null;
      }
    });
  }

  @Override
  public void close() {
    lock.lock();
    try {
      closeConnection();
    } finally {
      lock.unlock();
    }
  }

  private Optional<NetworkSnapshot> findSnapshot(String id) {
    if (id == null || id.isBlank()) {
      throw new ValidationException("snapshot id is required");
    }
    return inTransaction("getById", c -> {
      try (PreparedStatement query = c.prepareStatement(
          "SELECT " + SNAPSHOT_COLUMNS + " FROM network_snapshots s WHERE s.id = ?")) {
        query.setString(1, id);
        try (ResultSet rows = query.executeQuery()) {
          return rows.next() ? Optional.of(readSnapshot(rows)) : Optional.<NetworkSnapshot>empty();
        }
      }
    });
  }

  private static void requireSnapshot(Connection c, String id) throws SQLException {
    try (PreparedStatement query = c.prepareStatement("SELECT 1 FROM network_snapshots WHERE id = ?")) {
      query.setString(1, id);
      try (ResultSet rows = query.executeQuery()) {
        if (!rows.next()) {
          throw new NotFoundException("snapshot not found: " + id);
        }
      }
    }
  }

  private static Optional<String> findDiffId(Connection c, String fromId, String toId) throws SQLException {
    try (PreparedStatement query = c.prepareStatement(
        "SELECT id FROM snapshot_diffs WHERE from_snapshot_id = ? AND to_snapshot_id = ?")) {
      query.setString(1, fromId);
      query.setString(2, toId);
      try (ResultSet rows = query.executeQuery()) {
        return rows.next() ? Optional.of(rows.getString(1)) : Optional.empty();
      }
    }
  }

  private NetworkSnapshot readSnapshot(ResultSet rows) throws SQLException {
    String id = rows.getString(1);
    try {
      return new NetworkSnapshot(
          id,
          rows.getObject(2, OffsetDateTime.class).toInstant(),
          rows.getInt(3),
          rows.getInt(4),
          rows.getString(5),
          json.read(rows.getString(7), DEVICE_LIST),
          json.read(rows.getString(6), SnapshotMetadata.class));
    } catch (IllegalArgumentException ex) {
      throw new InfrastructureException("stored snapshot " + id + " is unreadable: " + ex.getMessage(), ex, false);
    }
  }

  private SnapshotDiff readDiff(String payload) {
    try {
      return json.read(payload, SnapshotDiff.class);
    } catch (IllegalArgumentException ex) {
      throw new InfrastructureException("stored diff is unreadable: " + ex.getMessage(), ex, false);
    }
  }

  private static String sortColumn(SnapshotQuery.SortField field) {
    return switch (field) {
      case TIMESTAMP -> "s.taken_at";
      case DEVICE_COUNT -> "s.device_count";
      case TOTAL_PORTS -> "s.total_ports";
    };
  }

  private static void bind(PreparedStatement statement, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      statement.setObject(i + 1, params.get(i));
    }
  }

  private static OffsetDateTime toOffset(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  private <T> T inTransaction(String operation, SqlWork<T> work) {
    lock.lock();
    try {
      Connection c = connection();
      c.setAutoCommit(false);
      try {
        T result = work.run(c);
        c.commit();
        return result;
      } catch (SQLException | RuntimeException ex) {
        rollback(c);
        throw ex;
      }
    } catch (SQLException ex) {
      throw translate(operation, ex);
    } finally {
      lock.unlock();
    }
  }

  private Connection connection() throws SQLException {
    if (connection == null || connection.isClosed()) {
      log.debug("Opening database connection");
      connection = connections.open();
    }
    return connection;
  }

  private InfrastructureException translate(String operation, SQLException ex) {
    String state = ex.getSQLState();
    boolean connectivity = ex instanceof SQLTransientException || (state != null && state.startsWith("08"));
    metrics.increment("store.error." + (connectivity ? "connection" : "sql"));
    if (connectivity) {
      closeConnection();
      log.warn("Store {} lost connectivity (SQLState {}): {}", operation, state, ex.getMessage());
    } else {
      log.error("Store {} failed (SQLState {}): {}", operation, state, ex.getMessage());
    }
    return new InfrastructureException("store " + operation + " failed: " + ex.getMessage(), ex, connectivity);
  }

  private void rollback(Connection c) {
    try {
      c.rollback();
    } catch (SQLException rollbackFailure) {
      log.warn("Rollback failed: {}", rollbackFailure.getMessage());
    }
  }

  private void closeConnection() {
    Connection current = connection;
    connection = null;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (SQLException ex) {
      log.warn("Closing database connection failed: {}", ex.getMessage());
    }
  }

  @FunctionalInterface
  private interface SqlWork<T> {
    T run(Connection connection) throws SQLException;
  }
}
