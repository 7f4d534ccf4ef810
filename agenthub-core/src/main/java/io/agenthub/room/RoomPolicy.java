package io.agenthub.room;

import java.util.Locale;

/**
 * How agents map to rooms.
 */
public enum RoomPolicy {
  /** One room per agent, scope key {@code agent:<agentId>}. */
  DEDICATED,
  /**
   * One room per owner shared by all its bound agents, scope key {@code owner:<ownerId>}.
   * An agent without an owner falls back to its dedicated scope.
   */
  SHARED;

  /**
   * Parses a configuration value, case-insensitively.
   *
   * @throws IllegalArgumentException for anything but {@code dedicated} or {@code shared}
   */
  public static RoomPolicy parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Room policy must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown room policy: " + value + " (expected dedicated or shared)", e);
    }
  }
}
