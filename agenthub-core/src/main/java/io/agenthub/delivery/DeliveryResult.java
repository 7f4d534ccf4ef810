package io.agenthub.delivery;

import io.agenthub.model.DeliveryRecord;
import io.agenthub.model.DeliveryStatus;

import java.util.List;

/**
 * Outcome of {@link DeliveryPipeline#send}.
 *
 * @param duplicate {@code true} if the delivery id had been used before and nothing was sent
 * @param warnings  lossy-translation warnings, empty for duplicates
 */
public record DeliveryResult(
    String deliveryId,
    DeliveryStatus status,
    String roomId,
    String channelEventId,
    int attempts,
    boolean duplicate,
    List<String> warnings
) {
  public DeliveryResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  static DeliveryResult of(DeliveryRecord record, boolean duplicate, List<String> warnings) {
    return new DeliveryResult(record.deliveryId(), record.status(), record.roomId(),
        record.channelEventId(), record.attempts(), duplicate, warnings);
  }
}
