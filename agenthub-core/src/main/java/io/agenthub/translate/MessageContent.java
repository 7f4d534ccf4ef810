package io.agenthub.translate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Message content as the hub understands it: a fixed set of variants with known fields
 * plus an opaque {@code extensions} map for everything else.
 *
 * <p>Extensions with a namespaced key (containing a dot, e.g. {@code com.example.trace})
 * are carried into the channel payload; all other extensions are dropped by the
 * {@link Translator} with a warning.
 */
public sealed interface MessageContent
    permits MessageContent.Text, MessageContent.Notice, MessageContent.Card, MessageContent.Delivery {

  String DELIVERY_MSGTYPE = "agenthub.delivery";

  Map<String, Object> extensions();

  /**
   * Plain text rendering used as the channel body.
   */
  String body();

  record Text(String body, Map<String, Object> extensions) implements MessageContent {
    public Text {
      Objects.requireNonNull(body, "body");
      extensions = copy(extensions);
    }

    public Text(String body) {
      this(body, Map.of());
    }
  }

  record Notice(String body, Map<String, Object> extensions) implements MessageContent {
    public Notice {
      Objects.requireNonNull(body, "body");
      extensions = copy(extensions);
    }
  }

  /**
   * Interactive card. Only {@code title} and {@code summary} survive translation; the
   * card {@code elements} (buttons, layout blocks) have no channel equivalent.
   */
  record Card(String title, String summary, List<Map<String, Object>> elements,
      Map<String, Object> extensions) implements MessageContent {
    public Card {
      title = title == null ? "" : title;
      summary = summary == null ? "" : summary;
      elements = elements == null ? List.of() : List.copyOf(elements);
      extensions = copy(extensions);
    }

    @Override
    public String body() {
      if (title.isEmpty()) {
        return summary;
      }
      return summary.isEmpty() ? title : title + "\n" + summary;
    }
  }

  /**
   * Semantic delivery event consumed by channel adapters, e.g. an approval request
   * card to be rendered on the IM side.
   *
   * @param semanticType e.g. {@code approval_request}, {@code alert_notification}, {@code text}
   * @param target       where the adapter should deliver, e.g. {@code channel} and {@code receive_id}
   */
  record Delivery(String semanticType, Map<String, Object> target, Map<String, Object> payload,
      String body, Map<String, Object> extensions) implements MessageContent {
    public Delivery {
      semanticType = semanticType == null || semanticType.isBlank() ? "text" : semanticType;
      target = copy(target);
      payload = copy(payload);
      body = body == null ? "" : body;
      extensions = copy(extensions);
    }
  }

  /**
   * Reads content from its JSON form, as posted to the send endpoint.
   *
   * <p>{@code msgtype} selects the variant: {@code m.notice}, {@link #DELIVERY_MSGTYPE},
   * {@code card}, anything else is text. Unrecognised keys become extensions.
   */
  @SuppressWarnings("unchecked")
  static MessageContent fromMap(Map<String, Object> fields) {
    Map<String, Object> rest = new LinkedHashMap<>(fields);
    Object msgtype = rest.remove("msgtype");
    String body = stringOrEmpty(rest.remove("body"));
    if ("m.notice".equals(msgtype)) {
      return new Notice(body, rest);
    }
    if (DELIVERY_MSGTYPE.equals(msgtype)) {
      Object semanticType = rest.remove("semantic_type");
      Object target = rest.remove("target");
      Object payload = rest.remove("payload");
      return new Delivery(semanticType == null ? null : semanticType.toString(),
          target instanceof Map ? (Map<String, Object>) target : Map.of(),
          payload instanceof Map ? (Map<String, Object>) payload : Map.of(),
          body, rest);
    }
    if ("card".equals(msgtype)) {
      String title = stringOrEmpty(rest.remove("title"));
      String summary = stringOrEmpty(rest.remove("summary"));
      Object elements = rest.remove("elements");
      List<Map<String, Object>> list = elements instanceof List
          ? (List<Map<String, Object>>) elements : List.of();
      return new Card(title, summary.isEmpty() ? body : summary, list, rest);
    }
    if (msgtype != null && !"m.text".equals(msgtype)) {
      rest.put("msgtype", msgtype);
    }
    return new Text(body, rest);
  }

  private static String stringOrEmpty(Object value) {
    return value == null ? "" : value.toString();
  }

  private static Map<String, Object> copy(Map<String, Object> map) {
    return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
