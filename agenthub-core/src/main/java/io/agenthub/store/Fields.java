package io.agenthub.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over record field maps, used by {@link RecordMapper} implementations.
 *
 * <p>Timestamps are stored as ISO-8601 strings so that every backend keeps the same
 * text; numbers come back from the codec as {@code Long} or {@code Double}.
 */
public final class Fields {

  private Fields() {}

  public static String string(Map<String, Object> record, String name) {
    Object value = record.get(name);
    if (value == null) {
      throw new IllegalStateException("Missing field: " + name);
    }
    return value.toString();
  }

  public static String optionalString(Map<String, Object> record, String name) {
    Object value = record.get(name);
    return value == null ? null : value.toString();
  }

  public static int intValue(Map<String, Object> record, String name) {
    Object value = record.get(name);
    if (!(value instanceof Number number)) {
      throw new IllegalStateException("Missing numeric field: " + name);
    }
    return number.intValue();
  }

  public static Instant instant(Map<String, Object> record, String name) {
    return Instant.parse(string(record, name));
  }

  public static Instant optionalInstant(Map<String, Object> record, String name) {
    String value = optionalString(record, name);
    return value == null ? null : Instant.parse(value);
  }

  public static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  public static <E extends Enum<E>> E enumValue(Map<String, Object> record, String name, Class<E> type) {
    return Enum.valueOf(type, string(record, name));
  }

  public static Map<String, String> stringMap(Map<String, Object> record, String name) {
    Object value = record.get(name);
    if (!(value instanceof Map<?, ?> map)) {
      return Map.of();
    }
    Map<String, String> result = new LinkedHashMap<>();
    map.forEach((k, v) -> result.put(k.toString(), v == null ? null : v.toString()));
    return Collections.unmodifiableMap(result);
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> objectMap(Map<String, Object> record, String name) {
    Object value = record.get(name);
    if (!(value instanceof Map<?, ?>)) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) value));
  }

  public static List<String> stringList(Map<String, Object> record, String name) {
    Object value = record.get(name);
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<String> result = new ArrayList<>(list.size());
    for (Object item : list) {
      result.add(String.valueOf(item));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Builds a field map that keeps {@code null} values, in insertion order.
   */
  public static Map<String, Object> record(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected name/value pairs");
    }
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      record.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return record;
  }
}
