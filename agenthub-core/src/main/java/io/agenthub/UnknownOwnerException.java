package io.agenthub;

public final class UnknownOwnerException extends AgentHubException {
  private final String ownerId;

  public UnknownOwnerException(String ownerId) {
    super("Unknown owner: " + ownerId);
    this.ownerId = ownerId;
  }

  public String ownerId() {
    return ownerId;
  }
}
