package io.agenthub.jdbc.dialect;

import io.agenthub.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * PostgreSQL dialect. Uses {@code ON CONFLICT} for both atomic writes.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String payloadType() {
    return "TEXT";
  }

  @Override
  public boolean insertIfAbsent(Connection conn, String table, String collection, String key,
      String payload, Timestamp now) {
    return JdbcTemplate.update(conn, "INSERT INTO " + table
            + " (collection, record_key, payload, revision, updated_at) VALUES (?, ?, ?, 1, ?)"
            + " ON CONFLICT (collection, record_key) DO NOTHING",
        collection, key, payload, now) > 0;
  }

  @Override
  public void upsert(Connection conn, String table, String collection, String key,
      String payload, Timestamp now) {
    JdbcTemplate.update(conn, "INSERT INTO " + table
            + " (collection, record_key, payload, revision, updated_at) VALUES (?, ?, ?, 1, ?)"
            + " ON CONFLICT (collection, record_key) DO UPDATE SET payload = EXCLUDED.payload,"
            + " revision = " + table + ".revision + 1, updated_at = EXCLUDED.updated_at",
        collection, key, payload, now);
  }
}
