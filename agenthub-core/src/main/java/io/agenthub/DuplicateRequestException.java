package io.agenthub;

/**
 * Thrown when an approval request id is reused with a different payload.
 * Reuse with an identical payload is not an error.
 */
public final class DuplicateRequestException extends AgentHubException {
  private final String requestId;

  public DuplicateRequestException(String requestId) {
    super("Approval request already exists with a different payload: " + requestId);
    this.requestId = requestId;
  }

  public String requestId() {
    return requestId;
  }
}
