package io.agenthub.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message in enterprise IM format: a message type plus its type-specific content object.
 *
 * @param senderId IM user id of the author, {@code null} for outbound messages
 */
public record NativeMessage(
    NativeMessageType type,
    String senderId,
    Map<String, Object> content
) {
  public NativeMessage {
    Objects.requireNonNull(type, "type");
    content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }

  public static NativeMessage text(String senderId, String text) {
    return new NativeMessage(NativeMessageType.TEXT, senderId, Map.of("text", text));
  }

  /**
   * Body of the IM send-message API: {@code {"msg_type": ..., "content": {...}}}.
   */
  public Map<String, Object> toSendRequest() {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("msg_type", type.wireName());
    request.put("content", content);
    return request;
  }
}
