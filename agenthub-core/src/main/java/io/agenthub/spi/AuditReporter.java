package io.agenthub.spi;

import io.agenthub.model.ApprovalRequest;
import io.agenthub.model.AuditEvent;

/**
 * Uploads audit information to the external policy/audit service.
 *
 * <p>Reports are fire-and-forget from the hub's point of view: failures are logged
 * by the caller and never fail the operation being audited.
 */
public interface AuditReporter {

    /**
     * No-op reporter used when no audit endpoint is configured.
     */
    AuditReporter NOOP = new AuditReporter() {
        @Override
        public void reportMessage(AuditEvent event) {
        }

        @Override
        public void reportApproval(ApprovalRequest request) {
        }
    };

    /**
     * Reports a delivered (or attempted) message.
     *
     * @param event the audit event
     * @throws CollaboratorException if the upload failed
     */
    void reportMessage(AuditEvent event) throws CollaboratorException;

    /**
     * Reports a resolved approval request.
     *
     * @param request the request in its resolved state
     * @throws CollaboratorException if the upload failed
     */
    void reportApproval(ApprovalRequest request) throws CollaboratorException;
}
