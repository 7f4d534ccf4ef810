package io.agenthub.approval;

import io.agenthub.DuplicateRequestException;
import io.agenthub.UnknownRequestException;
import io.agenthub.model.ApprovalDecision;
import io.agenthub.model.ApprovalRequest;
import io.agenthub.model.ApprovalStatus;
import io.agenthub.spi.AuditReporter;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.spi.MetricsExporter;
import io.agenthub.spi.RecordStore;
import io.agenthub.store.Fields;
import io.agenthub.store.RecordCollection;
import io.agenthub.store.RecordMapper;
import io.agenthub.util.Ids;
import io.agenthub.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Correlates approval requests with the decisions that come back through callbacks.
 *
 * <p>Decisions live in their own collection keyed by request id and are written with
 * {@code putIfAbsent}: the first callback wins and every later callback, whatever its
 * decision, reads the stored one back. The request record is then moved to RESOLVED;
 * a crash between the two writes is harmless because reads consult the decision first.
 */
public final class ApprovalCoordinator {
  private static final Logger logger = Logger.getLogger(ApprovalCoordinator.class.getName());

  static final String REQUESTS = "approval_requests";
  static final String DECISIONS = "approval_decisions";

  static final RecordMapper<ApprovalRequest> REQUEST_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(ApprovalRequest request) {
      return request.requestId();
    }

    @Override
    public Map<String, Object> toRecord(ApprovalRequest request) {
      return Fields.record(
          "requestId", request.requestId(),
          "payload", request.payload(),
          "status", request.status().name(),
          "decision", request.decision(),
          "approverId", request.approverId(),
          "comment", request.comment(),
          "createdAt", Fields.format(request.createdAt()),
          "resolvedAt", Fields.format(request.resolvedAt()));
    }

    @Override
    public ApprovalRequest fromRecord(Map<String, Object> record) {
      return new ApprovalRequest(
          Fields.string(record, "requestId"),
          Fields.objectMap(record, "payload"),
          Fields.enumValue(record, "status", ApprovalStatus.class),
          Fields.optionalString(record, "decision"),
          Fields.optionalString(record, "approverId"),
          Fields.optionalString(record, "comment"),
          Fields.instant(record, "createdAt"),
          Fields.optionalInstant(record, "resolvedAt"));
    }
  };

  static final RecordMapper<ApprovalDecision> DECISION_MAPPER = new RecordMapper<>() {
    @Override
    public String keyOf(ApprovalDecision decision) {
      return decision.requestId();
    }

    @Override
    public Map<String, Object> toRecord(ApprovalDecision decision) {
      return Fields.record(
          "requestId", decision.requestId(),
          "decision", decision.decision(),
          "approverId", decision.approverId(),
          "comment", decision.comment(),
          "decidedAt", Fields.format(decision.decidedAt()));
    }

    @Override
    public ApprovalDecision fromRecord(Map<String, Object> record) {
      return new ApprovalDecision(
          Fields.string(record, "requestId"),
          Fields.string(record, "decision"),
          Fields.optionalString(record, "approverId"),
          Fields.optionalString(record, "comment"),
          Fields.instant(record, "decidedAt"));
    }
  };

  private final RecordCollection<ApprovalRequest> requests;
  private final RecordCollection<ApprovalDecision> decisions;
  private final Clock clock;
  private final JsonCodec jsonCodec;
  private final AuditReporter auditReporter;
  private final Executor auditExecutor;
  private final MetricsExporter metrics;

  public ApprovalCoordinator(RecordStore store, Clock clock, AuditReporter auditReporter,
      Executor auditExecutor, MetricsExporter metrics) {
    this.requests = new RecordCollection<>(store, REQUESTS, REQUEST_MAPPER);
    this.decisions = new RecordCollection<>(store, DECISIONS, DECISION_MAPPER);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jsonCodec = JsonCodec.getDefault();
    this.auditReporter = Objects.requireNonNull(auditReporter, "auditReporter");
    this.auditExecutor = Objects.requireNonNull(auditExecutor, "auditExecutor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates a pending request. Repeating the call with an identical payload returns the
   * existing request.
   *
   * @throws DuplicateRequestException if the id exists with a different payload
   */
  public ApprovalRequest createRequest(String requestId, Map<String, Object> payload) {
    Ids.require(requestId, "requestId");
    Objects.requireNonNull(payload, "payload");
    ApprovalRequest candidate = ApprovalRequest.pending(requestId, jsonCodec.normalize(payload),
        clock.instant());
    RecordCollection.Stored<ApprovalRequest> stored = requests.putIfAbsent(candidate);
    if (!stored.created() && !stored.value().payload().equals(candidate.payload())) {
      throw new DuplicateRequestException(requestId);
    }
    return withDecision(stored.value());
  }

  public ApprovalResult resolve(String requestId, String decision) {
    return resolve(requestId, decision, null, null);
  }

  /**
   * Records a decision. Only the first decision for a request is stored; repeated
   * callbacks return it unchanged.
   *
   * @throws UnknownRequestException if no such request was created
   */
  public ApprovalResult resolve(String requestId, String decision, String approverId, String comment) {
    Ids.require(requestId, "requestId");
    Ids.require(decision, "decision");
    ApprovalRequest request = requests.get(requestId)
        .orElseThrow(() -> new UnknownRequestException(requestId));
    ApprovalDecision candidate = new ApprovalDecision(requestId, decision, approverId, comment,
        clock.instant());
    RecordCollection.Stored<ApprovalDecision> stored = decisions.putIfAbsent(candidate);
    ApprovalDecision winner = stored.value();
    ApprovalRequest resolved = markResolved(request, winner);
    if (stored.created()) {
      metrics.incrementApprovalResolved();
      logger.info("Approval " + requestId + " resolved: " + winner.decision());
      report(resolved);
    } else if (!winner.decision().equals(decision)) {
      logger.fine(() -> "Ignoring late decision '" + decision + "' for " + requestId);
    }
    return ApprovalResult.of(winner);
  }

  /**
   * Current state of a request. Never blocks.
   *
   * @throws UnknownRequestException if no such request was created
   */
  public ApprovalResult getResult(String requestId) {
    Ids.require(requestId, "requestId");
    if (requests.get(requestId).isEmpty()) {
      throw new UnknownRequestException(requestId);
    }
    return decisions.get(requestId).map(ApprovalResult::of)
        .orElseGet(() -> ApprovalResult.pending(requestId));
  }

  public Optional<ApprovalRequest> find(String requestId) {
    return requests.get(Ids.require(requestId, "requestId")).map(this::withDecision);
  }

  /**
   * Requests still awaiting a decision, in request id order.
   */
  public List<ApprovalRequest> pending() {
    List<ApprovalRequest> pending = new ArrayList<>();
    for (ApprovalRequest request : requests.query(r -> !r.isResolved())) {
      if (decisions.get(request.requestId()).isEmpty()) {
        pending.add(request);
      }
    }
    return pending;
  }

  private ApprovalRequest withDecision(ApprovalRequest request) {
    if (request.isResolved()) {
      return request;
    }
    return decisions.get(request.requestId()).map(request::resolved).orElse(request);
  }

  private ApprovalRequest markResolved(ApprovalRequest request, ApprovalDecision decision) {
    ApprovalRequest current = request;
    while (!current.isResolved()) {
      ApprovalRequest next = current.resolved(decision);
      if (requests.replace(current, next)) {
        return next;
      }
      current = requests.get(current.requestId()).orElse(next);
    }
    return current;
  }

  private void report(ApprovalRequest resolved) {
    try {
      auditExecutor.execute(() -> {
        try {
          auditReporter.reportApproval(resolved);
        } catch (CollaboratorException | RuntimeException e) {
          metrics.incrementAuditFailed();
          logger.log(Level.WARNING, "Approval audit report failed for " + resolved.requestId(), e);
        }
      });
    } catch (RejectedExecutionException e) {
      metrics.incrementAuditFailed();
      logger.log(Level.WARNING, "Approval audit report dropped for " + resolved.requestId(), e);
    }
  }
}
