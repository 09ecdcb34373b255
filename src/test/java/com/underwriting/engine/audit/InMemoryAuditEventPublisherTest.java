package com.underwriting.engine.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.underwriting.engine.audit.AuditPublisherFacadeTest.createEvent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAuditEventPublisherTest {

    private InMemoryAuditEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new InMemoryAuditEventPublisher();
    }

    @Test
    void keepsEventsInPublishOrder() {
        publisher.publish(createEvent("case-1"));
        publisher.publish(createEvent("case-2"));

        assertThat(publisher.published())
                .extracting(AuditEvent::getCaseId)
                .containsExactly("case-1", "case-2");
    }

    @Test
    void publishedIsAReadOnlyCopy() {
        publisher.publish(createEvent("case-1"));

        List<AuditEvent> snapshot = publisher.published();
        publisher.publish(createEvent("case-2"));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(createEvent("case-3")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void drainEmptiesTheTrail() {
        publisher.publish(createEvent("case-1"));

        assertThat(publisher.drain()).hasSize(1);
        assertThat(publisher.drain()).isEmpty();
        assertThat(publisher.published()).isEmpty();
    }
}
