package io.agenthub.store;

import java.util.Objects;

/**
 * Shared validation of collection names and record keys, applied identically by
 * every record store.
 */
public final class RecordNames {
  public static final int MAX_KEY_LENGTH = 255;
  private static final String COLLECTION_PATTERN = "[a-z_][a-z0-9_]{0,63}";

  private RecordNames() {}

  public static String collection(String collection) {
    Objects.requireNonNull(collection, "collection");
    if (!collection.matches(COLLECTION_PATTERN)) {
      throw new IllegalArgumentException("Invalid collection name: " + collection);
    }
    return collection;
  }

  public static String key(String key) {
    Objects.requireNonNull(key, "key");
    if (key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
      throw new IllegalArgumentException("Record key must be 1.." + MAX_KEY_LENGTH + " characters");
    }
    return key;
  }
}
