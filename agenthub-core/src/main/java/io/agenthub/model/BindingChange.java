package io.agenthub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of an agent's ownership history. {@code fromOwner} is {@code null} for the
 * first bind and {@code toOwner} is {@code null} for an unbind.
 */
public record BindingChange(
    String agentId,
    String fromOwner,
    String toOwner,
    Instant at
) {
  public BindingChange {
    Objects.requireNonNull(agentId, "agentId");
    Objects.requireNonNull(at, "at");
  }
}
