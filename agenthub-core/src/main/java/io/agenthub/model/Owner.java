package io.agenthub.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A human principal owning zero or more agents. The identity never changes once created.
 */
public record Owner(
    String ownerId,
    Map<String, String> metadata,
    Instant createdAt
) {
  public Owner {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(createdAt, "createdAt");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
