package io.agenthub.jdbc;

import io.agenthub.StorageUnavailableException;
import io.agenthub.jdbc.dialect.Dialects;
import io.agenthub.jdbc.spi.Dialect;
import io.agenthub.spi.ConnectionProvider;
import io.agenthub.spi.PutResult;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.RecordNames;
import io.agenthub.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * {@link RecordStore} over a single relational table.
 *
 * <p>Every collection shares the table; rows are keyed by {@code (collection, record_key)}
 * and carry the record as JSON text plus a revision counter. {@link #putIfAbsent} relies
 * on the primary key; {@link #replace} compares the stored record with the expected one
 * and then updates conditionally on the revision it read, retrying when another writer
 * got in between. Results of {@link #query} and {@link #listKeys} are ordered by key in
 * Java, so every database returns them in the same order as the in-memory store.
 *
 * <pre>{@code
 * RecordStore store = JdbcRecordStore.builder()
 *     .dataSource(dataSource)
 *     .createSchema(true)
 *     .build();
 * }</pre>
 */
public final class JdbcRecordStore implements RecordStore {
  private static final Logger logger = Logger.getLogger(JdbcRecordStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final String table;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  private JdbcRecordStore(Builder builder) {
    ConnectionProvider provider = builder.connectionProvider;
    if (provider == null && builder.dataSource != null) {
      provider = new DataSourceConnectionProvider(builder.dataSource);
    }
    this.connectionProvider = Objects.requireNonNull(provider, "connectionProvider or dataSource");
    this.dialect = builder.dialect != null ? builder.dialect : Dialects.detect(connectionProvider);
    this.table = TableNames.validate(builder.tableName != null ? builder.tableName : TableNames.DEFAULT_TABLE);
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.createSchema) {
      createSchema();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the record table if it does not exist.
   */
  public void createSchema() {
    inConnection(conn -> JdbcTemplate.update(conn, dialect.createTableSql(table)));
    logger.info("Record table '" + table + "' ready (" + dialect.name() + ")");
  }

  public Dialect dialect() {
    return dialect;
  }

  public String tableName() {
    return table;
  }

  @Override
  public String name() {
    return dialect.name();
  }

  @Override
  public void put(String collection, String key, Map<String, Object> record) {
    String c = RecordNames.collection(collection);
    String k = RecordNames.key(key);
    String payload = encode(record);
    inConnection(conn -> {
      dialect.upsert(conn, table, c, k, payload, now());
      return null;
    });
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, String key) {
    String c = RecordNames.collection(collection);
    String k = RecordNames.key(key);
    return inConnection(conn -> read(conn, c, k)).map(row -> jsonCodec.parseObject(row.payload()));
  }

  @Override
  public PutResult putIfAbsent(String collection, String key, Map<String, Object> record) {
    String c = RecordNames.collection(collection);
    String k = RecordNames.key(key);
    String payload = encode(record);
    return inConnection(conn -> {
      while (true) {
        if (dialect.insertIfAbsent(conn, table, c, k, payload, now())) {
          return new PutResult(jsonCodec.parseObject(payload), true);
        }
        Optional<Row> existing = read(conn, c, k);
        if (existing.isPresent()) {
          return new PutResult(jsonCodec.parseObject(existing.get().payload()), false);
        }
        // deleted between the insert and the read; try again
      }
    });
  }

  @Override
  public boolean replace(String collection, String key, Map<String, Object> expected,
      Map<String, Object> replacement) {
    String c = RecordNames.collection(collection);
    String k = RecordNames.key(key);
    Objects.requireNonNull(expected, "expected");
    Map<String, Object> normalizedExpected = jsonCodec.normalize(expected);
    String payload = encode(replacement);
    String sql = "UPDATE " + table + " SET payload = ?, revision = revision + 1, updated_at = ?"
        + " WHERE collection = ? AND record_key = ? AND revision = ?";
    return inConnection(conn -> {
      while (true) {
        Optional<Row> current = read(conn, c, k);
        if (current.isEmpty()
            || !jsonCodec.parseObject(current.get().payload()).equals(normalizedExpected)) {
          return false;
        }
        if (JdbcTemplate.update(conn, sql, payload, now(), c, k, current.get().revision()) == 1) {
          return true;
        }
      }
    });
  }

  @Override
  public List<Map<String, Object>> query(String collection, Predicate<Map<String, Object>> predicate) {
    String c = RecordNames.collection(collection);
    Objects.requireNonNull(predicate, "predicate");
    List<String[]> rows = inConnection(conn -> JdbcTemplate.query(conn,
        "SELECT record_key, payload FROM " + table + " WHERE collection = ?",
        rs -> new String[] {rs.getString(1), rs.getString(2)}, c));
    rows.sort(Comparator.comparing(row -> row[0]));
    List<Map<String, Object>> results = new ArrayList<>();
    for (String[] row : rows) {
      Map<String, Object> record = jsonCodec.parseObject(row[1]);
      if (predicate.test(record)) {
        results.add(record);
      }
    }
    return results;
  }

  @Override
  public boolean delete(String collection, String key) {
    String c = RecordNames.collection(collection);
    String k = RecordNames.key(key);
    return inConnection(conn -> JdbcTemplate.update(conn,
        "DELETE FROM " + table + " WHERE collection = ? AND record_key = ?", c, k)) > 0;
  }

  @Override
  public List<String> listKeys(String collection, String prefix) {
    String c = RecordNames.collection(collection);
    Objects.requireNonNull(prefix, "prefix");
    List<String> keys = inConnection(conn -> JdbcTemplate.query(conn,
        "SELECT record_key FROM " + table + " WHERE collection = ? AND record_key LIKE ? ESCAPE '!'",
        rs -> rs.getString(1), c, escapeLike(prefix) + "%"));
    List<String> sorted = new ArrayList<>(keys);
    sorted.sort(Comparator.naturalOrder());
    return sorted;
  }

  static String escapeLike(String prefix) {
    StringBuilder sb = new StringBuilder(prefix.length() + 4);
    for (int i = 0; i < prefix.length(); i++) {
      char ch = prefix.charAt(i);
      if (ch == '!' || ch == '%' || ch == '_') {
        sb.append('!');
      }
      sb.append(ch);
    }
    return sb.toString();
  }

  private Optional<Row> read(Connection conn, String collection, String key) {
    List<Row> rows = JdbcTemplate.query(conn,
        "SELECT payload, revision FROM " + table + " WHERE collection = ? AND record_key = ?",
        rs -> new Row(rs.getString(1), rs.getLong(2)), collection, key);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private String encode(Map<String, Object> record) {
    Objects.requireNonNull(record, "record");
    return jsonCodec.toJson(record);
  }

  private Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  private <T> T inConnection(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Connection failure on table " + table, e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn);
  }

  private record Row(String payload, long revision) {
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DataSource dataSource;
    private Dialect dialect;
    private String tableName;
    private JsonCodec jsonCodec;
    private Clock clock;
    private boolean createSchema;

    private Builder() {
    }

    /**
     * Connection source. Either this or {@link #dataSource} is <b>required</b>.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * SQL dialect. Detected from the connection URL when not set.
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Table name, default {@value TableNames#DEFAULT_TABLE}.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Run the table DDL on build. Off by default.
     */
    public Builder createSchema(boolean createSchema) {
      this.createSchema = createSchema;
      return this;
    }

    public JdbcRecordStore build() {
      return new JdbcRecordStore(this);
    }
  }
}
