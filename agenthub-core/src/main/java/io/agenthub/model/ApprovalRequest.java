package io.agenthub.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request awaiting an external decision. Once resolved the decision never changes.
 */
public record ApprovalRequest(
    String requestId,
    Map<String, Object> payload,
    ApprovalStatus status,
    String decision,
    String approverId,
    String comment,
    Instant createdAt,
    Instant resolvedAt
) {
  public ApprovalRequest {
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    if (status == ApprovalStatus.RESOLVED && decision == null) {
      throw new IllegalArgumentException("RESOLVED request needs a decision");
    }
  }

  public static ApprovalRequest pending(String requestId, Map<String, Object> payload, Instant now) {
    return new ApprovalRequest(requestId, payload, ApprovalStatus.PENDING, null, null, null, now, null);
  }

  public ApprovalRequest resolved(ApprovalDecision approvalDecision) {
    return new ApprovalRequest(requestId, payload, ApprovalStatus.RESOLVED,
        approvalDecision.decision(), approvalDecision.approverId(), approvalDecision.comment(),
        createdAt, approvalDecision.decidedAt());
  }

  public boolean isResolved() {
    return status == ApprovalStatus.RESOLVED;
  }
}
