package com.underwriting.engine.audit;

public interface AuditEventPublisher {

    /**
     * Hands an audit event to the audit trail.
     *
     * @throws AuditException if the event could not be recorded
     */
    void publish(AuditEvent event);
}
