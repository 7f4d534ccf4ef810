package io.agenthub;

/**
 * Thrown after every send attempt of a delivery failed. The delivery record is left
 * in status FAILED.
 */
public final class DeliveryFailedException extends AgentHubException {
  private final String deliveryId;
  private final int attempts;

  public DeliveryFailedException(String deliveryId, int attempts, Throwable cause) {
    super("Delivery " + deliveryId + " failed after " + attempts + " attempt(s)", cause);
    this.deliveryId = deliveryId;
    this.attempts = attempts;
  }

  public String deliveryId() {
    return deliveryId;
  }

  public int attempts() {
    return attempts;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
