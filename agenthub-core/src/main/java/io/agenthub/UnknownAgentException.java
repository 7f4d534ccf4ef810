package io.agenthub;

/**
 * Thrown when an operation names an agent that is not registered, or one that has
 * been revoked where an active agent is required.
 */
public final class UnknownAgentException extends AgentHubException {
  private final String agentId;

  public UnknownAgentException(String agentId) {
    this(agentId, "Unknown agent: " + agentId);
  }

  public UnknownAgentException(String agentId, String message) {
    super(message);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }
}
