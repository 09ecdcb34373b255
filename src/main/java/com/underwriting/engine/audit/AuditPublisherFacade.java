package com.underwriting.engine.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Facade that selects the active AuditEventPublisher implementation based on configuration.
 */
@ApplicationScoped
public class AuditPublisherFacade implements AuditEventPublisher {

    @ConfigProperty(name = "app.audit.mode", defaultValue = "logging")
    String mode;

    @Inject
    @Named("logging-audit")
    LoggingAuditEventPublisher loggingPublisher;

    @Inject
    @Named("in-memory-audit")
    InMemoryAuditEventPublisher inMemoryPublisher;

    AuditEventPublisher delegate() {
        if ("in-memory".equalsIgnoreCase(mode)) {
            return inMemoryPublisher;
        }
        return loggingPublisher;
    }

    @Override
    public void publish(AuditEvent event) {
        delegate().publish(event);
    }
}
