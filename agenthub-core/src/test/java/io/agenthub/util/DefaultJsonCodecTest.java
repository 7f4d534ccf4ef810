package io.agenthub.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void toJsonWritesNestedValues() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", "A1");
    map.put("count", 3);
    map.put("ratio", 0.5);
    map.put("ok", true);
    map.put("tags", List.of("x", "y"));
    map.put("meta", Map.of("k", "v"));

    String json = codec.toJson(map);

    assertEquals("{\"name\":\"A1\",\"count\":3,\"ratio\":0.5,\"ok\":true,"
        + "\"tags\":[\"x\",\"y\"],\"meta\":{\"k\":\"v\"}}", json);
  }

  @Test
  void toJsonEscapesSpecialCharacters() {
    String json = codec.toJson(Map.of("msg", "Hello \"World\"\nNew\\Line\u0001"));

    assertTrue(json.contains("\\\"World\\\""));
    assertTrue(json.contains("\\n"));
    assertTrue(json.contains("\\\\"));
    assertTrue(json.contains("\\u0001"));
  }

  @Test
  void toJsonWithNullValue() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("key", null);

    assertEquals("{\"key\":null}", codec.toJson(map));
    assertEquals("null", codec.toJson(null));
  }

  @Test
  void toJsonWritesEnumsByName() {
    assertEquals("\"MONDAY\"", codec.toJson(java.time.DayOfWeek.MONDAY));
  }

  @Test
  void toJsonRejectsNonStringKeys() {
    Map<Object, Object> map = new LinkedHashMap<>();
    map.put(1, "value");

    assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
  }

  @Test
  void toJsonRejectsNonFiniteNumbers() {
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(Map.of("x", Double.NaN)));
  }

  @Test
  void toJsonRejectsUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(Map.of("x", new Object())));
  }

  @Test
  void parseReturnsCanonicalTypes() {
    Object value = codec.parse("{\"i\":42,\"d\":1.5,\"e\":1e3,\"b\":false,\"n\":null,\"a\":[1,\"two\"]}");

    Map<?, ?> map = assertInstanceOf(Map.class, value);
    assertEquals(42L, map.get("i"));
    assertEquals(1.5, map.get("d"));
    assertEquals(1000.0, map.get("e"));
    assertEquals(Boolean.FALSE, map.get("b"));
    assertTrue(map.containsKey("n"));
    assertNull(map.get("n"));
    assertEquals(List.of(1L, "two"), map.get("a"));
  }

  @Test
  void parseHandlesEscapesAndWhitespace() {
    Map<String, Object> map = codec.parseObject(" { \"k\" : \"a\\\"b\\\\c\\/d\\u00e9\\n\" } ");

    assertEquals("a\"b\\c/dé\n", map.get("k"));
  }

  @Test
  void parseObjectOfBlankOrNullIsEmpty() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
    assertTrue(codec.parseObject("null").isEmpty());
  }

  @Test
  void parseObjectRejectsArrays() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1]"));
  }

  @Test
  void parseRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":1"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\" 1}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":1} x"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("\"unterminated"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("tru"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse(null));
  }

  @Test
  void normalizeConvertsIntegersToLongAndCopiesDeeply() {
    List<Object> items = new ArrayList<>();
    items.add(1);
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("n", 7);
    record.put("items", items);

    Map<String, Object> normalized = codec.normalize(record);
    items.add(2);

    assertEquals(7L, normalized.get("n"));
    assertEquals(List.of(1L), normalized.get("items"));
  }
}
