package io.agenthub.jdbc.spi;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific SQL of the record table. Register
 * custom dialects via {@code META-INF/services/io.agenthub.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see io.agenthub.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * DDL creating the record table if it does not exist.
   *
   * <p>Columns: collection, record_key, payload, revision, updated_at. Primary key
   * {@code (collection, record_key)}; key comparison must be case-sensitive.
   */
  String createTableSql(String table);

  /**
   * Inserts a row with revision 1 unless the key is taken.
   *
   * @return {@code true} if this call inserted the row
   */
  boolean insertIfAbsent(Connection conn, String table, String collection, String key,
      String payload, Timestamp now);

  /**
   * Inserts a row, or overwrites the payload and increments the revision of an existing one.
   */
  void upsert(Connection conn, String table, String collection, String key,
      String payload, Timestamp now);
}
