package io.agenthub.identity;

import io.agenthub.model.RelationshipEdge;

import java.util.List;

/**
 * Transitive collaboration chain below an agent.
 *
 * @param members descendants of the root in breadth-first order, root excluded
 * @param edges   the edges traversed, in the same order
 * @param depth   length of the longest shortest path from the root, 0 for a leaf
 */
public record ChainSummary(
    String rootAgentId,
    List<String> members,
    List<RelationshipEdge> edges,
    int depth
) {
  public ChainSummary {
    members = List.copyOf(members);
    edges = List.copyOf(edges);
  }
}
