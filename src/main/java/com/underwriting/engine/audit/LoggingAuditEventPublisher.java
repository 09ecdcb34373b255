package com.underwriting.engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

/**
 * Writes audit events as single-line JSON to the {@code audit} log category,
 * where the log shipper forwards them to the audit store.
 */
@ApplicationScoped
@Named("logging-audit")
public class LoggingAuditEventPublisher implements AuditEventPublisher {

    private static final Logger AUDIT = Logger.getLogger("audit");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public void publish(AuditEvent event) {
        try {
            AUDIT.info(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new AuditException("Failed to serialize audit event " + event.getAction(), e);
        }
    }
}
