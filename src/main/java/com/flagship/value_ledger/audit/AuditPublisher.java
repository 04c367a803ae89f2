package com.flagship.value_ledger.audit;

import com.flagship.value_ledger.ledger.TransactionHooks;
import com.flagship.value_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget delivery of audit events.
 *
 * Events raised inside a ledger transaction are held until it commits, so a
 * rolled-back mutation is never audited. Sink failures are counted and logged only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditPublisher {

    private final AuditSink sink;
    private final LedgerMetrics metrics;

    public void publishAfterCommit(AuditEvent event) {
        TransactionHooks.afterCommit(() -> deliver(event));
    }

    void deliver(AuditEvent event) {
        try {
            sink.record(event);
        } catch (RuntimeException e) {
            metrics.recordAuditFailure();
            log.warn("Audit event not recorded: action={}, targetType={}, targetId={}, error={}",
                    event.getAction(), event.getTargetType(), event.getTargetId(), e.getMessage());
        }
    }
}
