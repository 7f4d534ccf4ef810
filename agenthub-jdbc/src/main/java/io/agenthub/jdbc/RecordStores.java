package io.agenthub.jdbc;

import io.agenthub.jdbc.dialect.Dialects;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.InMemoryRecordStore;

import java.sql.DriverManager;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Opens the record store for a {@link StorageSettings} variant.
 *
 * <p>Relational variants get their table created if missing. There is no fallback: a
 * database that cannot be reached fails here instead of degrading to memory.
 */
public final class RecordStores {
  private static final Logger logger = Logger.getLogger(RecordStores.class.getName());

  private RecordStores() {
  }

  public static RecordStore open(StorageSettings settings) {
    return open(settings, TableNames.DEFAULT_TABLE);
  }

  public static RecordStore open(StorageSettings settings, String tableName) {
    Objects.requireNonNull(settings, "settings");
    RecordStore store;
    if (settings instanceof StorageSettings.Memory) {
      store = new InMemoryRecordStore();
    } else if (settings instanceof StorageSettings.EmbeddedFile file) {
      String url = file.jdbcUrl();
      store = JdbcRecordStore.builder()
          .connectionProvider(() -> DriverManager.getConnection(url))
          .dialect(Dialects.get("h2"))
          .tableName(tableName)
          .createSchema(true)
          .build();
    } else if (settings instanceof StorageSettings.MySql mysql) {
      store = JdbcRecordStore.builder()
          .dataSource(mysql.dataSource())
          .dialect(Dialects.get("mysql"))
          .tableName(tableName)
          .createSchema(true)
          .build();
    } else if (settings instanceof StorageSettings.Postgres postgres) {
      store = JdbcRecordStore.builder()
          .dataSource(postgres.dataSource())
          .dialect(Dialects.get("postgresql"))
          .tableName(tableName)
          .createSchema(true)
          .build();
    } else {
      throw new IllegalArgumentException("Unsupported storage settings: " + settings);
    }
    logger.info("Opened '" + store.name() + "' record store");
    return store;
  }
}
