package io.agenthub.jdbc;

import java.util.Objects;

/**
 * Shared table name validation for the JDBC record store and its dialects.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "agenthub_record";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
