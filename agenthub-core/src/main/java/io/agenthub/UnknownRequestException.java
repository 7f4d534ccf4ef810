package io.agenthub;

public final class UnknownRequestException extends AgentHubException {
  private final String requestId;

  public UnknownRequestException(String requestId) {
    super("Unknown approval request: " + requestId);
    this.requestId = requestId;
  }

  public String requestId() {
    return requestId;
  }
}
