package io.agenthub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted state of one delivery. Moves only from STARTED to COMPLETED or FAILED.
 *
 * @param sender agent id, or {@link #SYSTEM_SENDER} for hub-originated messages
 */
public record DeliveryRecord(
    String deliveryId,
    String sender,
    String receiver,
    String roomId,
    DeliveryStatus status,
    int attempts,
    String channelEventId,
    String lastError,
    Instant startedAt,
    Instant updatedAt
) {
  public static final String SYSTEM_SENDER = "agenthub";

  public DeliveryRecord {
    Objects.requireNonNull(deliveryId, "deliveryId");
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(receiver, "receiver");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  public static DeliveryRecord started(String deliveryId, String sender, String receiver,
      String roomId, Instant now) {
    return new DeliveryRecord(deliveryId, sender, receiver, roomId, DeliveryStatus.STARTED,
        0, null, null, now, now);
  }

  /**
   * Same state with {@code updatedAt} moved to {@code now}; used to claim an abandoned send.
   */
  public DeliveryRecord touched(Instant now) {
    return new DeliveryRecord(deliveryId, sender, receiver, roomId, status, attempts,
        channelEventId, lastError, startedAt, now);
  }

  public DeliveryRecord completed(int totalAttempts, String eventId, Instant now) {
    return new DeliveryRecord(deliveryId, sender, receiver, roomId, DeliveryStatus.COMPLETED,
        totalAttempts, eventId, null, startedAt, now);
  }

  public DeliveryRecord failed(int totalAttempts, String error, Instant now) {
    return new DeliveryRecord(deliveryId, sender, receiver, roomId, DeliveryStatus.FAILED,
        totalAttempts, null, error, startedAt, now);
  }
}
