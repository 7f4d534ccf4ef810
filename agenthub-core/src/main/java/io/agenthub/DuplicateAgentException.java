package io.agenthub;

/**
 * Thrown when registering an agent whose id is already taken.
 */
public final class DuplicateAgentException extends AgentHubException {
  private final String agentId;

  public DuplicateAgentException(String agentId) {
    super("Agent already registered: " + agentId);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }
}
