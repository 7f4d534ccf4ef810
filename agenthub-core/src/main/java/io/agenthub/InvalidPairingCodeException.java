package io.agenthub;

/**
 * A submitted pairing code is unknown, already used or past its expiry.
 */
public final class InvalidPairingCodeException extends AgentHubException {
  private final String code;
  private final boolean expired;

  public InvalidPairingCodeException(String code, boolean expired) {
    super(expired ? "Pairing code expired: " + code : "Unknown or used pairing code: " + code);
    this.code = code;
    this.expired = expired;
  }

  public String code() {
    return code;
  }

  public boolean isExpired() {
    return expired;
  }
}
