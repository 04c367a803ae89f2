package com.flagship.value_ledger.audit;

import com.flagship.value_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditPublisherTest {

    private AuditSink sink;
    private SimpleMeterRegistry registry;
    private AuditPublisher publisher;

    @BeforeEach
    void setUp() {
        sink = mock(AuditSink.class);
        registry = new SimpleMeterRegistry();
        publisher = new AuditPublisher(sink, new LedgerMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    private static AuditEvent event() {
        return AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .action("LEDGER_EARN")
                .actorId(UUID.randomUUID().toString())
                .actorType("user")
                .targetType("ledger_account")
                .targetId(UUID.randomUUID())
                .description("Points earned")
                .metadataEntry("delta", 100L)
                .occurredAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("Without a transaction the event is recorded immediately")
    void testNoTransaction() {
        AuditEvent event = event();

        publisher.publishAfterCommit(event);

        verify(sink).record(event);
    }

    @Test
    @DisplayName("Inside a transaction the event waits for the commit")
    void testDeferredUntilCommit() {
        TransactionSynchronizationManager.initSynchronization();
        AuditEvent event = event();

        publisher.publishAfterCommit(event);
        verify(sink, never()).record(any());

        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        verify(sink).record(event);
    }

    @Test
    @DisplayName("A rolled-back transaction is never audited")
    void testRollbackNotAudited() {
        TransactionSynchronizationManager.initSynchronization();

        publisher.publishAfterCommit(event());
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }

        verify(sink, never()).record(any());
    }

    @Test
    @DisplayName("A failing sink is counted and never propagates")
    void testSinkFailureSwallowedAndCounted() {
        doThrow(new IllegalStateException("outbox down")).when(sink).record(any());

        assertDoesNotThrow(() -> publisher.publishAfterCommit(event()));

        assertEquals(1.0, registry.get("audit.sink.failures").counter().count());
    }
}
