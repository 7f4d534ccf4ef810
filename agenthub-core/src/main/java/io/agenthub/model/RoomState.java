package io.agenthub.model;

public enum RoomState {
  /** A creator has claimed the scope and is calling the channel provisioner. */
  PROVISIONING,
  READY
}
