package io.agenthub.jdbc.dialect;

import io.agenthub.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * MySQL dialect. Also works with TiDB.
 *
 * <p>Key columns use a binary collation so record keys compare case-sensitively, like
 * the other backends.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public String createTableSql(String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "collection VARCHAR(64) CHARACTER SET utf8mb4 COLLATE utf8mb4_bin NOT NULL, "
        + "record_key VARCHAR(255) CHARACTER SET utf8mb4 COLLATE utf8mb4_bin NOT NULL, "
        + "payload LONGTEXT NOT NULL, "
        + "revision BIGINT NOT NULL, "
        + "updated_at DATETIME(6) NOT NULL, "
        + "PRIMARY KEY (collection, record_key)"
        + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4";
  }

  @Override
  public void upsert(Connection conn, String table, String collection, String key,
      String payload, Timestamp now) {
    JdbcTemplate.update(conn, "INSERT INTO " + table
            + " (collection, record_key, payload, revision, updated_at) VALUES (?, ?, ?, 1, ?)"
            + " ON DUPLICATE KEY UPDATE payload = VALUES(payload), revision = revision + 1,"
            + " updated_at = VALUES(updated_at)",
        collection, key, payload, now);
  }
}
