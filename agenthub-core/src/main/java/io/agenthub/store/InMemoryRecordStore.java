package io.agenthub.store;

import io.agenthub.spi.PutResult;
import io.agenthub.spi.RecordStore;
import io.agenthub.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

/**
 * Process-local record store, the default backend. Contents are lost on restart.
 *
 * <p>Records are held as JSON text and parsed on every read, so callers get the same
 * canonical value types and the same isolation from later mutation as with the JDBC
 * stores. {@code putIfAbsent} and {@code replace} are atomic within the process.
 */
public final class InMemoryRecordStore implements RecordStore {
  private final ConcurrentMap<String, ConcurrentNavigableMap<String, String>> collections =
      new ConcurrentHashMap<>();
  private final JsonCodec jsonCodec;

  public InMemoryRecordStore() {
    this(JsonCodec.getDefault());
  }

  public InMemoryRecordStore(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public String name() {
    return "memory";
  }

  @Override
  public void put(String collection, String key, Map<String, Object> record) {
    bucket(collection).put(RecordNames.key(key), encode(record));
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, String key) {
    String json = bucket(collection).get(RecordNames.key(key));
    return json == null ? Optional.empty() : Optional.of(jsonCodec.parseObject(json));
  }

  @Override
  public PutResult putIfAbsent(String collection, String key, Map<String, Object> record) {
    String json = encode(record);
    String existing = bucket(collection).putIfAbsent(RecordNames.key(key), json);
    if (existing == null) {
      return new PutResult(jsonCodec.parseObject(json), true);
    }
    return new PutResult(jsonCodec.parseObject(existing), false);
  }

  @Override
  public boolean replace(String collection, String key, Map<String, Object> expected,
      Map<String, Object> replacement) {
    Objects.requireNonNull(expected, "expected");
    ConcurrentNavigableMap<String, String> bucket = bucket(collection);
    RecordNames.key(key);
    Map<String, Object> normalizedExpected = jsonCodec.normalize(expected);
    String json = encode(replacement);
    while (true) {
      String current = bucket.get(key);
      if (current == null || !jsonCodec.parseObject(current).equals(normalizedExpected)) {
        return false;
      }
      if (bucket.replace(key, current, json)) {
        return true;
      }
    }
  }

  @Override
  public List<Map<String, Object>> query(String collection, Predicate<Map<String, Object>> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    List<Map<String, Object>> results = new ArrayList<>();
    for (String json : bucket(collection).values()) {
      Map<String, Object> record = jsonCodec.parseObject(json);
      if (predicate.test(record)) {
        results.add(record);
      }
    }
    return results;
  }

  @Override
  public boolean delete(String collection, String key) {
    return bucket(collection).remove(RecordNames.key(key)) != null;
  }

  @Override
  public List<String> listKeys(String collection, String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    List<String> keys = new ArrayList<>();
    for (String key : bucket(collection).keySet()) {
      if (key.startsWith(prefix)) {
        keys.add(key);
      }
    }
    return keys;
  }

  private ConcurrentNavigableMap<String, String> bucket(String collection) {
    return collections.computeIfAbsent(RecordNames.collection(collection),
        c -> new ConcurrentSkipListMap<>());
  }

  private String encode(Map<String, Object> record) {
    Objects.requireNonNull(record, "record");
    return jsonCodec.toJson(record);
  }
}
