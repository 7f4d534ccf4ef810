package io.agenthub.spi;

/**
 * Checked exception raised by external collaborators (channel, chain, audit).
 *
 * <p>Components translate it into the caller-facing {@link io.agenthub.AgentHubException}
 * hierarchy at their boundary. A {@linkplain #isTransient() transient} failure, including
 * a timeout, is retried by the caller; a permanent one is not.
 */
public class CollaboratorException extends Exception {
  private final boolean transientFailure;

  public CollaboratorException(String message) {
    this(message, null, true);
  }

  public CollaboratorException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public CollaboratorException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /**
   * Creates a failure that retrying will not fix (e.g. the remote rejected the request).
   */
  public static CollaboratorException permanent(String message) {
    return new CollaboratorException(message, null, false);
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
