package com.underwriting.engine.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Test-friendly, in-memory audit trail.
 */
@ApplicationScoped
@Named("in-memory-audit")
public class InMemoryAuditEventPublisher implements AuditEventPublisher {

    private final BlockingQueue<AuditEvent> events = new LinkedBlockingQueue<>();

    @Override
    public void publish(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> published() {
        return List.copyOf(events);
    }

    public List<AuditEvent> drain() {
        List<AuditEvent> batch = new ArrayList<>();
        events.drainTo(batch);
        return batch;
    }
}
