package com.flagship.value_ledger.audit;

/**
 * Receiver of audit events.
 *
 * Called after the ledger transaction has committed. Implementations may fail;
 * a failure is logged by {@link AuditPublisher} and never affects the ledger.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
