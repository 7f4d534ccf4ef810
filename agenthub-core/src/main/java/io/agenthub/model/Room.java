package io.agenthub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Mapping from a routing scope to an external channel room.
 *
 * @param roomId     channel room id, {@code null} while provisioning
 * @param claimToken token of the caller that claimed the scope for provisioning
 */
public record Room(
    String scopeKey,
    String roomId,
    RoomState state,
    String claimToken,
    Instant createdAt
) {
  public Room {
    Objects.requireNonNull(scopeKey, "scopeKey");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(createdAt, "createdAt");
    if (state == RoomState.READY && roomId == null) {
      throw new IllegalArgumentException("READY room needs a roomId");
    }
  }

  public static Room placeholder(String scopeKey, String claimToken, Instant now) {
    return new Room(scopeKey, null, RoomState.PROVISIONING, claimToken, now);
  }

  public Room ready(String newRoomId, Instant now) {
    return new Room(scopeKey, newRoomId, RoomState.READY, claimToken, now);
  }

  public boolean isReady() {
    return state == RoomState.READY;
  }
}
