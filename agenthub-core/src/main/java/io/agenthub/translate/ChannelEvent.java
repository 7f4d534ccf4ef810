package io.agenthub.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message event received from the channel.
 *
 * @param sender the channel user id of the author, e.g. {@code @alice:example.org}
 */
public record ChannelEvent(
    String roomId,
    String eventId,
    String sender,
    Map<String, Object> content
) {
  public ChannelEvent {
    content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    Objects.requireNonNull(sender, "sender");
  }

  public String msgtype() {
    Object msgtype = content.get("msgtype");
    return msgtype == null ? "m.text" : msgtype.toString();
  }
}
