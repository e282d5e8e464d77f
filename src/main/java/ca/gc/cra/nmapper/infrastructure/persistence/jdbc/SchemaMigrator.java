package ca.gc.cra.nmapper.infrastructure.persistence.jdbc;

import ca.gc.cra.nmapper.domain.error.InfrastructureException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the versioned SQL scripts under {@code db/migration} that are not yet recorded in
 * {@code schema_migrations}.
 * <p>Each script runs in its own transaction together with its bookkeeping row. A recorded script whose content
 * hash changed fails the migration rather than silently diverging.</p>
 */
final class SchemaMigrator {
  private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

  static final List<String> SCRIPTS = List.of("001_initial_schema.sql", "002_scan_statistics_view.sql");
  private static final String LOCATION = "/db/migration/";

  private final List<String> scripts;

  SchemaMigrator() {
    this(SCRIPTS);
  }

  SchemaMigrator(List<String> scripts) {
    this.scripts = List.copyOf(Objects.requireNonNull(scripts, "scripts"));
  }

  /**
   * Brings the schema up to date.
   *
   * @param connection open connection; auto-commit is restored afterwards
   * @return number of scripts applied
   * @throws SQLException if a statement fails
   * @throws InfrastructureException if a script is missing or was modified after being applied
   */
  int migrate(Connection connection) throws SQLException {
    boolean autoCommit = connection.getAutoCommit();
    try {
      ensureBookkeeping(connection);
      Map<String, String> applied = appliedVersions(connection);
      int count = 0;
      for (String script : scripts) {
        String version = script.substring(0, script.indexOf('_'));
        String sql = load(script);
        String checksum = sha256(sql);
        String recorded = applied.get(version);
        if (recorded != null) {
          if (!recorded.equals(checksum)) {
            throw new InfrastructureException(
                "migration " + script + " changed after it was applied", null, false);
          }
          continue;
        }
        apply(connection, version, script, sql, checksum);
        count++;
      }
      if (count > 0) {
        log.info("Applied {} schema migration(s)", count);
      } else {
        log.debug("Schema is up to date");
      }
      return count;
    } finally {
      connection.setAutoCommit(autoCommit);
    }
  }

  private void apply(Connection connection, String version, String script, String sql, String checksum)
      throws SQLException {
    connection.setAutoCommit(false);
    try (Statement statement = connection.createStatement()) {
      for (String part : statements(sql)) {
        statement.execute(part);
      }
      try (PreparedStatement insert = connection.prepareStatement(
          "INSERT INTO schema_migrations (version, filename, checksum, applied_at) VALUES (?, ?, ?, ?)")) {
        insert.setString(1, version);
        insert.setString(2, script);
        insert.setString(3, checksum);
        insert.setObject(4, OffsetDateTime.now(ZoneOffset.UTC));
        insert.executeUpdate();
      }
      connection.commit();
      log.info("Applied migration {}", script);
    } catch (SQLException | RuntimeException ex) {
      rollbackQuietly(connection);
      throw ex;
    }
  }

  private static void ensureBookkeeping(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      statement.execute("CREATE TABLE IF NOT EXISTS schema_migrations ("
          + "version VARCHAR(50) PRIMARY KEY, "
          + "filename VARCHAR(255) NOT NULL, "
          + "checksum VARCHAR(64) NOT NULL, "
          + "applied_at TIMESTAMP WITH TIME ZONE NOT NULL)");
    }
  }

  private static Map<String, String> appliedVersions(Connection connection) throws SQLException {
    Map<String, String> applied = new LinkedHashMap<>();
    try (Statement statement = connection.createStatement();
        ResultSet rows = statement.executeQuery("SELECT version, checksum FROM schema_migrations")) {
      while (rows.next()) {
        applied.put(rows.getString(1), rows.getString(2));
      }
    }
    return applied;
  }

  static List<String> statements(String sql) {
    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : sql.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(line).append('\n');
      if (trimmed.endsWith(";")) {
        String statement = current.toString().trim();
        result.add(statement.substring(0, statement.length() - 1));
        current.setLength(0);
      }
    }
    if (!current.toString().isBlank()) {
      result.add(current.toString().trim());
    }
    return result;
  }

  private static String load(String script) {
    try (InputStream in = SchemaMigrator.class.getResourceAsStream(LOCATION + script)) {
      if (in == null) {
        throw new InfrastructureException("migration script not found: " + script, null, false);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new InfrastructureException("cannot read migration script " + script, ex, false);
    }
  }

  private static String sha256(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  private static void rollbackQuietly(Connection connection) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      log.error("Rollback of failed migration failed", rollbackFailure);
    }
  }
}
