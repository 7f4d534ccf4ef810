package io.agenthub.jdbc.dialect;

import io.agenthub.jdbc.JdbcTemplate;
import io.agenthub.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.Timestamp;

/**
 * Base class with standard SQL shared by all dialects. Subclasses override what
 * their database does natively.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "collection VARCHAR(64) NOT NULL, "
        + "record_key VARCHAR(255) NOT NULL, "
        + "payload " + payloadType() + " NOT NULL, "
        + "revision BIGINT NOT NULL, "
        + "updated_at TIMESTAMP NOT NULL, "
        + "PRIMARY KEY (collection, record_key))";
  }

  /**
   * Column type of the JSON payload.
   */
  protected String payloadType() {
    return "CLOB";
  }

  @Override
  public boolean insertIfAbsent(Connection conn, String table, String collection, String key,
      String payload, Timestamp now) {
    String sql = "INSERT INTO " + table
        + " (collection, record_key, payload, revision, updated_at) VALUES (?, ?, ?, 1, ?)";
    return JdbcTemplate.insertIfAbsent(conn, sql, collection, key, payload, now);
  }

  @Override
  public void upsert(Connection conn, String table, String collection, String key,
      String payload, Timestamp now) {
    String sql = "UPDATE " + table
        + " SET payload = ?, revision = revision + 1, updated_at = ?"
        + " WHERE collection = ? AND record_key = ?";
    // an insert lost to a concurrent writer means the row exists now; update again
    while (JdbcTemplate.update(conn, sql, payload, now, collection, key) == 0) {
      if (insertIfAbsent(conn, table, collection, key, payload, now)) {
        return;
      }
    }
  }
}
