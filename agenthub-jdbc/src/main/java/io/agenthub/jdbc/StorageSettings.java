package io.agenthub.jdbc;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Objects;

/**
 * The backends a hub can run on. Chosen once at startup and turned into a store by
 * {@link RecordStores#open(StorageSettings)}.
 */
public sealed interface StorageSettings {

  /**
   * Process-local store; contents are lost on restart.
   */
  record Memory() implements StorageSettings {
  }

  /**
   * Embedded H2 database in a local file.
   *
   * @param path database file path without the {@code .mv.db} suffix
   */
  record EmbeddedFile(Path path) implements StorageSettings {
    public EmbeddedFile {
      Objects.requireNonNull(path, "path");
    }

    public String jdbcUrl() {
      return "jdbc:h2:file:" + path.toAbsolutePath();
    }
  }

  record MySql(DataSource dataSource) implements StorageSettings {
    public MySql {
      Objects.requireNonNull(dataSource, "dataSource");
    }
  }

  record Postgres(DataSource dataSource) implements StorageSettings {
    public Postgres {
      Objects.requireNonNull(dataSource, "dataSource");
    }
  }
}
