package io.agenthub.translate;

import io.agenthub.model.AuditEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless conversion between IM messages and channel events.
 *
 * <p>Mappings: IM {@code text}, {@code post} and {@code interactive} become
 * {@code m.text}; channel {@code m.text} and {@code m.notice} become IM {@code text}.
 * Fields without an equivalent are dropped and reported on the returned
 * {@link Translation}, never as an error:
 * <ul>
 *   <li>rich-post styling, links targets and embedded media</li>
 *   <li>card header styling, elements and buttons (only title and text survive)</li>
 *   <li>extensions without a namespaced key</li>
 *   <li>channel formatting ({@code format}, {@code formatted_body}) and relations</li>
 * </ul>
 *
 * <p>Mentions ({@code @id}) and the sender are rewritten through the
 * {@link IdentityResolver}; references it cannot resolve pass through unchanged.
 */
public final class Translator {
  private static final Logger logger = Logger.getLogger(Translator.class.getName());

  public static final String SENDER_FIELD = "agenthub.sender";

  private static final Pattern NATIVE_MENTION = Pattern.compile("(?<![\\w@])@([A-Za-z0-9_.\\-]+)");
  private static final Pattern CHANNEL_MENTION =
      Pattern.compile("(?<![\\w@])@[A-Za-z0-9._=\\-/]+:[A-Za-z0-9.\\-]+(?::\\d+)?");
  private static final Pattern AT_TAG =
      Pattern.compile("<at user_id=\"([^\"]*)\">[^<]*</at>");
  private static final Set<String> AUDIT_FIELDS =
      Set.of("message_id", "sender", "receiver", "timestamp", SENDER_FIELD);

  private final IdentityResolver identityResolver;

  public Translator(IdentityResolver identityResolver) {
    this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver");
  }

  /**
   * Converts an IM message into a channel payload.
   */
  public Translation<ChannelPayload> toChannelFormat(NativeMessage message) {
    Objects.requireNonNull(message, "message");
    List<String> warnings = new ArrayList<>();
    String body = switch (message.type()) {
      case TEXT -> textBody(message.content(), warnings);
      case POST -> postBody(message.content(), warnings);
      case INTERACTIVE -> cardBody(message.content(), warnings);
    };
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("msgtype", "m.text");
    content.put("body", rewriteNativeMentions(body));
    if (message.senderId() != null) {
      content.put(SENDER_FIELD, identityResolver.toChannelId(message.senderId())
          .orElse(message.senderId()));
    }
    return finish(new ChannelPayload(content), warnings, message.type().wireName());
  }

  /**
   * Converts hub message content into a channel payload.
   */
  public Translation<ChannelPayload> toChannelFormat(MessageContent messageContent) {
    Objects.requireNonNull(messageContent, "messageContent");
    List<String> warnings = new ArrayList<>();
    Map<String, Object> content = new LinkedHashMap<>();
    String body = rewriteNativeMentions(messageContent.body());
    if (messageContent instanceof MessageContent.Text) {
      content.put("msgtype", "m.text");
      content.put("body", body);
    } else if (messageContent instanceof MessageContent.Notice) {
      content.put("msgtype", "m.notice");
      content.put("body", body);
    } else if (messageContent instanceof MessageContent.Card card) {
      content.put("msgtype", "m.text");
      content.put("body", body);
      if (!card.elements().isEmpty()) {
        warnings.add("dropped " + card.elements().size() + " card element(s)");
      }
    } else if (messageContent instanceof MessageContent.Delivery delivery) {
      content.put("msgtype", MessageContent.DELIVERY_MSGTYPE);
      content.put("body", body);
      content.put("semantic_type", delivery.semanticType());
      content.put("target", delivery.target());
      content.put("payload", delivery.payload());
    }
    for (Map.Entry<String, Object> extension : messageContent.extensions().entrySet()) {
      if (extension.getKey().contains(".")) {
        content.putIfAbsent(extension.getKey(), extension.getValue());
      } else {
        warnings.add("dropped extension '" + extension.getKey() + "'");
      }
    }
    return finish(new ChannelPayload(content), warnings, messageContent.getClass().getSimpleName());
  }

  /**
   * Converts a channel event into an IM text message.
   */
  public Translation<NativeMessage> toNativeFormat(ChannelEvent event) {
    Objects.requireNonNull(event, "event");
    List<String> warnings = new ArrayList<>();
    String msgtype = event.msgtype();
    if (!"m.text".equals(msgtype) && !"m.notice".equals(msgtype)) {
      warnings.add("msgtype " + msgtype + " rendered as text");
    }
    Object body = event.content().get("body");
    Set<String> dropped = new LinkedHashSet<>();
    for (String key : event.content().keySet()) {
      if (!"msgtype".equals(key) && !"body".equals(key) && !AUDIT_FIELDS.contains(key)) {
        dropped.add(key);
      }
    }
    if (!dropped.isEmpty()) {
      warnings.add("dropped channel fields " + dropped);
    }
    String text = rewriteChannelMentions(body == null ? "" : body.toString());
    String senderId = identityResolver.toNativeId(event.sender()).orElse(event.sender());
    NativeMessage message = new NativeMessage(NativeMessageType.TEXT, senderId, Map.of("text", text));
    return finish(message, warnings, msgtype);
  }

  /**
   * Adds the audit fields ({@code message_id}, {@code sender}, {@code receiver},
   * {@code timestamp} in epoch milliseconds) to a payload.
   */
  public static ChannelPayload injectAuditFields(ChannelPayload payload, AuditEvent event) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("message_id", event.messageId());
    fields.put("sender", event.sender());
    fields.put("receiver", event.receiver());
    fields.put("timestamp", event.timestamp().toEpochMilli());
    return payload.with(fields);
  }

  /**
   * Prefixes the body with the sender so that readers of a room shared by several
   * agents can tell messages apart.
   */
  public static ChannelPayload attributeSender(ChannelPayload payload, String sender) {
    return payload.with(Map.of("body", "[" + sender + "] " + payload.body()));
  }

  private <T> Translation<T> finish(T value, List<String> warnings, String source) {
    if (!warnings.isEmpty()) {
      logger.log(Level.WARNING, "Lossy translation of " + source + ": " + warnings);
    }
    return new Translation<>(value, warnings);
  }

  private static String textBody(Map<String, Object> content, List<String> warnings) {
    Object text = content.get("text");
    for (String key : content.keySet()) {
      if (!"text".equals(key)) {
        warnings.add("dropped text field '" + key + "'");
      }
    }
    String value = text == null ? "" : text.toString();
    return AT_TAG.matcher(value).replaceAll(m -> Matcher.quoteReplacement("@" + m.group(1)));
  }

  @SuppressWarnings("unchecked")
  private static String postBody(Map<String, Object> content, List<String> warnings) {
    Map<String, Object> post = content;
    if (!content.containsKey("content")) {
      // localized form: {"zh_cn": {"title": ..., "content": [...]}}
      for (Object value : content.values()) {
        if (value instanceof Map<?, ?> localized && localized.containsKey("content")) {
          post = (Map<String, Object>) localized;
          break;
        }
      }
    }
    List<String> lines = new ArrayList<>();
    Object title = post.get("title");
    if (title != null && !title.toString().isEmpty()) {
      lines.add(title.toString());
    }
    boolean styled = false;
    Set<String> droppedTags = new LinkedHashSet<>();
    if (post.get("content") instanceof List<?> paragraphs) {
      for (Object paragraph : paragraphs) {
        if (!(paragraph instanceof List<?> segments)) {
          continue;
        }
        StringBuilder line = new StringBuilder();
        for (Object item : segments) {
          if (!(item instanceof Map<?, ?> segment)) {
            continue;
          }
          if (segment.get("style") instanceof List<?> style && !style.isEmpty()) {
            styled = true;
          }
          String tag = String.valueOf(segment.get("tag"));
          switch (tag) {
            case "text", "md" -> line.append(valueOf(segment.get("text")));
            case "a" -> {
              line.append(valueOf(segment.get("text")));
              droppedTags.add("a.href");
            }
            case "at" -> line.append('@').append(valueOf(segment.get("user_id")));
            default -> droppedTags.add(tag);
          }
        }
        lines.add(line.toString());
      }
    }
    if (styled) {
      warnings.add("dropped rich-post styling");
    }
    if (!droppedTags.isEmpty()) {
      warnings.add("dropped rich-post elements " + droppedTags);
    }
    return String.join("\n", lines);
  }

  private static String cardBody(Map<String, Object> content, List<String> warnings) {
    List<String> lines = new ArrayList<>();
    if (content.get("header") instanceof Map<?, ?> header) {
      if (header.get("title") instanceof Map<?, ?> title && title.get("content") != null) {
        lines.add(title.get("content").toString());
      }
      if (header.containsKey("template")) {
        warnings.add("dropped card header styling");
      }
    }
    Set<String> droppedTags = new LinkedHashSet<>();
    if (content.get("elements") instanceof List<?> elements) {
      for (Object item : elements) {
        if (!(item instanceof Map<?, ?> element)) {
          continue;
        }
        String tag = String.valueOf(element.get("tag"));
        if ("markdown".equals(tag) && element.get("content") != null) {
          lines.add(element.get("content").toString());
        } else if ("div".equals(tag) && element.get("text") instanceof Map<?, ?> text
            && text.get("content") != null) {
          lines.add(text.get("content").toString());
        } else {
          droppedTags.add(tag);
        }
      }
    }
    if (!droppedTags.isEmpty()) {
      warnings.add("dropped card elements " + droppedTags);
    }
    return String.join("\n", lines);
  }

  private String rewriteNativeMentions(String body) {
    return NATIVE_MENTION.matcher(body).replaceAll(m -> Matcher.quoteReplacement(
        identityResolver.toChannelId(m.group(1)).orElse(m.group())));
  }

  private String rewriteChannelMentions(String body) {
    return CHANNEL_MENTION.matcher(body).replaceAll(m -> Matcher.quoteReplacement(
        identityResolver.toNativeId(m.group()).map(id -> "@" + id).orElse(m.group())));
  }

  private static String valueOf(Object value) {
    return value == null ? "" : value.toString();
  }
}
