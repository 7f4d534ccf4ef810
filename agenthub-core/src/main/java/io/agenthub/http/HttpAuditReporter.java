package io.agenthub.http;

import io.agenthub.model.ApprovalRequest;
import io.agenthub.model.AuditEvent;
import io.agenthub.spi.AuditReporter;
import io.agenthub.spi.CollaboratorException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link AuditReporter} posting JSON to the audit service. Either endpoint may be
 * {@code null}, in which case that kind of report is skipped.
 */
public final class HttpAuditReporter implements AuditReporter {
  private final String messageUrl;
  private final String approvalUrl;
  private final JsonHttp http;

  public HttpAuditReporter(String messageUrl, String approvalUrl, Duration timeout) {
    this(messageUrl, approvalUrl, JsonHttp.defaultClient(timeout), timeout);
  }

  HttpAuditReporter(String messageUrl, String approvalUrl, HttpClient client, Duration timeout) {
    this.messageUrl = blankToNull(messageUrl);
    this.approvalUrl = blankToNull(approvalUrl);
    this.http = new JsonHttp(client, timeout, null);
  }

  @Override
  public void reportMessage(AuditEvent event) throws CollaboratorException {
    if (messageUrl == null) {
      return;
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message_id", event.messageId());
    body.put("sender", event.sender());
    body.put("receiver", event.receiver());
    body.put("room_id", event.roomId());
    body.put("timestamp", event.timestamp().toEpochMilli());
    http.post(messageUrl, body);
  }

  @Override
  public void reportApproval(ApprovalRequest request) throws CollaboratorException {
    if (approvalUrl == null) {
      return;
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("request_id", request.requestId());
    body.put("decision", request.decision());
    body.put("approver_id", request.approverId());
    body.put("comment", request.comment());
    body.put("payload", request.payload());
    body.put("resolved_at", format(request.resolvedAt()));
    http.post(approvalUrl, body);
  }

  private static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
