package io.agenthub;

/**
 * Thrown when a sub-agent edge would close a cycle in the collaboration graph.
 */
public final class CycleDetectedException extends AgentHubException {
  private final String parentAgentId;
  private final String childAgentId;

  public CycleDetectedException(String parentAgentId, String childAgentId) {
    super("Edge " + parentAgentId + " -> " + childAgentId + " would create a cycle");
    this.parentAgentId = parentAgentId;
    this.childAgentId = childAgentId;
  }

  public String parentAgentId() {
    return parentAgentId;
  }

  public String childAgentId() {
    return childAgentId;
  }
}
