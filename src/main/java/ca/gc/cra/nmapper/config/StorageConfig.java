package ca.gc.cra.nmapper.config;

import ca.gc.cra.nmapper.logging.Logs;
import ca.gc.cra.nmapper.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot store selection.
 *
 * @param type backing store
 * @param url JDBC url; required for {@link Type#JDBC}
 * @param user database user; may be empty
 * @param password database password; may be empty
 * @since 0.1.0
 */
public record StorageConfig(Type type, String url, String user, String password) {

  public StorageConfig {
    type = Objects.requireNonNullElse(type, Type.JDBC);
    url = url == null ? "" : url.trim();
    user = user == null ? "" : user.trim();
    password = password == null ? "" : password;
    if (type == Type.JDBC) {
      Strings.requireNonBlank("storage.url", url);
      if (!url.startsWith("jdbc:")) {
        throw new IllegalArgumentException("storage.url must start with jdbc: (was " + url + ")");
      }
    }
  }

  /**
   * Local PostgreSQL database {@code nmapper}.
   *
   * @return default storage settings
   */
  public static StorageConfig defaults() {
    return new StorageConfig(Type.JDBC, "jdbc:postgresql://localhost:5432/nmapper", "nmapper", "");
  }

  /**
   * Reads {@code storage.type}, {@code storage.url}, {@code storage.user} and {@code storage.password}.
   *
   * @param options flat configuration
   * @return parsed settings
   * @throws IllegalArgumentException if a value is invalid
   */
  public static StorageConfig fromMap(Map<String, String> options) {
    StorageConfig defaults = defaults();
    return new StorageConfig(
        Type.from(options.get("storage.type")),
        options.getOrDefault("storage.url", defaults.url()),
        options.getOrDefault("storage.user", defaults.user()),
        options.getOrDefault("storage.password", defaults.password()));
  }

  @Override
  public String toString() {
    return "StorageConfig[type=" + type + ", url=" + url + ", user=" + user + ", password=" + Logs.redact(password)
        + "]";
  }

  /** Store implementations. */
  public enum Type {
    /** Relational database over JDBC. */
    JDBC,
    /** Process-local maps; contents are lost on exit. */
    MEMORY;

    static Type from(String raw) {
      if (raw == null || raw.isBlank()) {
        return JDBC;
      }
      try {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("storage.type must be jdbc or memory (was " + raw + ")", ex);
      }
    }
  }
}
