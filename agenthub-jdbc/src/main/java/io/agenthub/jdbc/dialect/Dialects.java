package io.agenthub.jdbc.dialect;

import io.agenthub.jdbc.spi.Dialect;
import io.agenthub.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for database dialects with auto-detection support.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.agenthub.jdbc.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.detect("jdbc:h2:file:./data/agenthub");
 * Dialect dialect = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  /**
   * Returns all registered dialects.
   */
  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect
   * @throws IllegalArgumentException if no dialect is registered under that name
   */
  public static Dialect get(String name) {
    Objects.requireNonNull(name, "name");
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Auto-detects the dialect from a DataSource's connection URL.
   *
   * @throws IllegalStateException if no connection can be opened
   */
  public static Dialect detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return detect((ConnectionProvider) dataSource::getConnection);
  }

  /**
   * Auto-detects the dialect from a connection provider's connection URL.
   *
   * @throws IllegalStateException if no connection can be opened
   */
  public static Dialect detect(ConnectionProvider connectionProvider) {
    try (Connection conn = connectionProvider.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from connection", e);
    }
  }

  /**
   * Auto-detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList());
  }
}
