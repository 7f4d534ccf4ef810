package io.agenthub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A short-lived code a human enters to confirm an agent registration for {@code ownerId}.
 *
 * @param agentDisplayName shown to the human while confirming, may be {@code null}
 */
public record PairingCode(
    String code,
    String ownerId,
    String agentDisplayName,
    Instant createdAt,
    Instant expiresAt
) {
  public PairingCode {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }
}
