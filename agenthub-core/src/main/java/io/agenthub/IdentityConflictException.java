package io.agenthub;

/**
 * Thrown when an owner is registered again with metadata that differs from the
 * stored record.
 */
public final class IdentityConflictException extends AgentHubException {
  private final String ownerId;

  public IdentityConflictException(String ownerId) {
    super("Owner already registered with different metadata: " + ownerId);
    this.ownerId = ownerId;
  }

  public String ownerId() {
    return ownerId;
  }
}
