package io.agenthub.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Last known liveness of an agent.
 *
 * @param status free-form status reported by the agent, e.g. "online"
 */
public record Presence(
    String agentId,
    String status,
    Instant lastSeen
) {
  public Presence {
    Objects.requireNonNull(agentId, "agentId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(lastSeen, "lastSeen");
  }

  public boolean isOnline(Instant now, Duration ttl) {
    return !lastSeen.plus(ttl).isBefore(now);
  }
}
