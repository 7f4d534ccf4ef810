package io.agenthub;

/**
 * Unchecked exception signalling that the configured record store could not be
 * reached or rejected an operation at the infrastructure level.
 */
public final class StorageUnavailableException extends AgentHubException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
