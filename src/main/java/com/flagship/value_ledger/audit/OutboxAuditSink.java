package com.flagship.value_ledger.audit;

import com.flagship.value_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Audit sink backed by the transactional outbox; the outbox publisher ships
 * the events to the audit topic.
 */
@Component
@RequiredArgsConstructor
public class OutboxAuditSink implements AuditSink {

    private final OutboxService outboxService;

    @Override
    public void record(AuditEvent event) {
        outboxService.appendEvent(event.getTargetType(), event.getTargetId(), event.getAction(), event);
    }
}
