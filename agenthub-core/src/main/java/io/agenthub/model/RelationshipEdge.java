package io.agenthub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Directed collaboration edge: the parent agent delegates to the child agent.
 */
public record RelationshipEdge(
    String parentAgentId,
    String childAgentId,
    Instant createdAt
) {
  public RelationshipEdge {
    Objects.requireNonNull(parentAgentId, "parentAgentId");
    Objects.requireNonNull(childAgentId, "childAgentId");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
