package io.agenthub.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Event content in channel (Matrix) format, ready to send as {@code m.room.message}.
 * Always contains {@code msgtype} and {@code body}.
 */
public record ChannelPayload(Map<String, Object> content) {

  public ChannelPayload {
    Objects.requireNonNull(content, "content");
    if (!(content.get("msgtype") instanceof String)) {
      throw new IllegalArgumentException("content needs a msgtype");
    }
    if (!(content.get("body") instanceof String)) {
      throw new IllegalArgumentException("content needs a body");
    }
    content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }

  public static ChannelPayload of(String msgtype, String body) {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("msgtype", msgtype);
    content.put("body", body);
    return new ChannelPayload(content);
  }

  public String msgtype() {
    return (String) content.get("msgtype");
  }

  public String body() {
    return (String) content.get("body");
  }

  /**
   * Returns a copy with {@code fields} added, replacing existing keys.
   */
  public ChannelPayload with(Map<String, Object> fields) {
    Map<String, Object> merged = new LinkedHashMap<>(content);
    merged.putAll(fields);
    return new ChannelPayload(merged);
  }
}
