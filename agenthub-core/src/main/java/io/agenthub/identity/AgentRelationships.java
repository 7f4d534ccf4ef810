package io.agenthub.identity;

import java.util.List;

/**
 * Everything the audit service needs to know about an agent's position: owner,
 * direct parents and children, and the chain below it.
 */
public record AgentRelationships(
    String agentId,
    String ownerId,
    List<String> parents,
    List<String> children,
    ChainSummary chain
) {
  public AgentRelationships {
    parents = List.copyOf(parents);
    children = List.copyOf(children);
  }
}
