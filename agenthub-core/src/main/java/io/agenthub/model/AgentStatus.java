package io.agenthub.model;

public enum AgentStatus {
  PENDING,
  ACTIVE,
  REVOKED;

  public boolean isTerminal() {
    return this == REVOKED;
  }
}
