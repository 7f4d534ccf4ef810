package io.agenthub.translate;

import java.util.Locale;

/**
 * Message types of the enterprise IM platform.
 */
public enum NativeMessageType {
  TEXT("text"),
  /** Rich text with paragraphs of styled segments. */
  POST("post"),
  /** Interactive card. */
  INTERACTIVE("interactive");

  private final String wireName;

  NativeMessageType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static NativeMessageType fromWireName(String name) {
    for (NativeMessageType type : values()) {
      if (type.wireName.equals(name.toLowerCase(Locale.ROOT))) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown IM message type: " + name);
  }
}
