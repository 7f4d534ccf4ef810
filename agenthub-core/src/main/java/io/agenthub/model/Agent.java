package io.agenthub.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An automated participant. Agents are never deleted, only revoked.
 *
 * @param ownerId the bound owner, {@code null} until bound
 * @param did     the chain identifier, {@code null} until registration completes
 */
public record Agent(
    String agentId,
    String ownerId,
    String did,
    AgentStatus status,
    Map<String, String> metadata,
    Instant createdAt,
    Instant updatedAt
) {
  public Agent {
    Objects.requireNonNull(agentId, "agentId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public boolean isBound() {
    return ownerId != null;
  }

  public Agent withOwner(String newOwnerId, Instant now) {
    return new Agent(agentId, newOwnerId, did, status, metadata, createdAt, now);
  }

  public Agent withDid(String newDid, Instant now) {
    return new Agent(agentId, ownerId, newDid, status, metadata, createdAt, now);
  }

  public Agent withStatus(AgentStatus newStatus, Instant now) {
    return new Agent(agentId, ownerId, did, newStatus, metadata, createdAt, now);
  }
}
