package io.agenthub.model;

import java.time.Instant;

/**
 * Audit information about one message, reported to the audit service and never stored.
 */
public record AuditEvent(
    String messageId,
    String sender,
    String receiver,
    String roomId,
    Instant timestamp
) {}
