package io.agenthub.model;

public enum DeliveryStatus {
  STARTED,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this != STARTED;
  }
}
