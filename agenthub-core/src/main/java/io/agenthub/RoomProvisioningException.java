package io.agenthub;

/**
 * Thrown when a room could not be provisioned for a scope. No room record is left
 * behind, so the call can be repeated.
 */
public final class RoomProvisioningException extends AgentHubException {
  private final String scopeKey;

  public RoomProvisioningException(String scopeKey, String message, Throwable cause) {
    super(message, cause);
    this.scopeKey = scopeKey;
  }

  public String scopeKey() {
    return scopeKey;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
