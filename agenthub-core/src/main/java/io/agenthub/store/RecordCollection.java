package io.agenthub.store;

import io.agenthub.spi.PutResult;
import io.agenthub.spi.RecordStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Typed view of one collection of a {@link RecordStore}.
 *
 * @param <T> the domain type stored in the collection
 */
public final class RecordCollection<T> {
  private final RecordStore store;
  private final String name;
  private final RecordMapper<T> mapper;

  public RecordCollection(RecordStore store, String name, RecordMapper<T> mapper) {
    this.store = Objects.requireNonNull(store, "store");
    this.name = RecordNames.collection(name);
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public String name() {
    return name;
  }

  public void put(T value) {
    store.put(name, mapper.keyOf(value), mapper.toRecord(value));
  }

  public Optional<T> get(String key) {
    return store.get(name, key).map(mapper::fromRecord);
  }

  /**
   * Stores {@code value} unless its key is taken.
   *
   * @return the stored value (the caller's or the existing one) and whether this call created it
   */
  public Stored<T> putIfAbsent(T value) {
    PutResult result = store.putIfAbsent(name, mapper.keyOf(value), mapper.toRecord(value));
    return new Stored<>(mapper.fromRecord(result.record()), result.created());
  }

  /**
   * Atomically swaps {@code expected} for {@code replacement}; both must share a key.
   */
  public boolean replace(T expected, T replacement) {
    String key = mapper.keyOf(expected);
    if (!key.equals(mapper.keyOf(replacement))) {
      throw new IllegalArgumentException("Replacement changes the key of " + key);
    }
    return store.replace(name, key, mapper.toRecord(expected), mapper.toRecord(replacement));
  }

  public boolean delete(String key) {
    return store.delete(name, key);
  }

  public List<T> query(Predicate<T> predicate) {
    List<T> results = new ArrayList<>();
    for (var record : store.query(name, r -> true)) {
      T value = mapper.fromRecord(record);
      if (predicate.test(value)) {
        results.add(value);
      }
    }
    return results;
  }

  public List<T> all() {
    return query(v -> true);
  }

  public List<String> keys(String prefix) {
    return store.listKeys(name, prefix);
  }

  /**
   * Outcome of {@link #putIfAbsent}.
   */
  public record Stored<T>(T value, boolean created) {}
}
