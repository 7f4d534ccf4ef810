package io.agenthub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The first decision recorded for an approval request.
 *
 * @param approverId who decided, may be {@code null}
 * @param comment    free text, may be {@code null}
 */
public record ApprovalDecision(
    String requestId,
    String decision,
    String approverId,
    String comment,
    Instant decidedAt
) {
  public ApprovalDecision {
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(decision, "decision");
    Objects.requireNonNull(decidedAt, "decidedAt");
  }
}
