package io.agenthub.delivery;

import io.agenthub.model.DeliveryRecord;
import io.agenthub.model.DeliveryStatus;

import java.time.Instant;

/**
 * Filter for {@link DeliveryPipeline#query}. Unset fields match everything; the time
 * range applies to {@code startedAt} and is inclusive.
 */
public record DeliveryQuery(
    String receiver,
    String sender,
    DeliveryStatus status,
    Instant from,
    Instant to,
    int limit
) {
  public static final int DEFAULT_LIMIT = 100;

  public DeliveryQuery {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  boolean matches(DeliveryRecord record) {
    return (receiver == null || receiver.equals(record.receiver()))
        && (sender == null || sender.equals(record.sender()))
        && (status == null || status == record.status())
        && (from == null || !record.startedAt().isBefore(from))
        && (to == null || !record.startedAt().isAfter(to));
  }

  public static final class Builder {
    private String receiver;
    private String sender;
    private DeliveryStatus status;
    private Instant from;
    private Instant to;
    private int limit = DEFAULT_LIMIT;

    private Builder() {}

    public Builder receiver(String receiver) {
      this.receiver = receiver;
      return this;
    }

    public Builder sender(String sender) {
      this.sender = sender;
      return this;
    }

    public Builder status(DeliveryStatus status) {
      this.status = status;
      return this;
    }

    public Builder between(Instant from, Instant to) {
      this.from = from;
      this.to = to;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public DeliveryQuery build() {
      return new DeliveryQuery(receiver, sender, status, from, to, limit);
    }
  }
}
