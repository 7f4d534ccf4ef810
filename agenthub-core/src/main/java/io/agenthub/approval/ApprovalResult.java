package io.agenthub.approval;

import io.agenthub.model.ApprovalDecision;
import io.agenthub.model.ApprovalStatus;

import java.time.Instant;

/**
 * Polling view of an approval request.
 *
 * @param decision {@code null} while PENDING
 */
public record ApprovalResult(
    String requestId,
    ApprovalStatus status,
    String decision,
    String approverId,
    String comment,
    Instant resolvedAt
) {

  static ApprovalResult pending(String requestId) {
    return new ApprovalResult(requestId, ApprovalStatus.PENDING, null, null, null, null);
  }

  static ApprovalResult of(ApprovalDecision decision) {
    return new ApprovalResult(decision.requestId(), ApprovalStatus.RESOLVED, decision.decision(),
        decision.approverId(), decision.comment(), decision.decidedAt());
  }

  public boolean isResolved() {
    return status == ApprovalStatus.RESOLVED;
  }
}
