package io.agenthub;

/**
 * Base of every error the hub surfaces to callers.
 *
 * <p>Validation failures ({@link #isRetryable()} {@code false}) are reported
 * immediately and never retried. Infrastructure failures are retried internally up
 * to a bound and only surface once exhausted; they report {@code true} so the caller
 * may retry the whole operation with the same identifiers.
 */
public abstract class AgentHubException extends RuntimeException {

  protected AgentHubException(String message) {
    super(message);
  }

  protected AgentHubException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether repeating the operation later may succeed.
   *
   * @return {@code true} for transient infrastructure failures
   */
  public boolean isRetryable() {
    return false;
  }
}
