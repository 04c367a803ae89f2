package com.flagship.value_ledger.observability;

import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.mutations: committed-or-attempted journal writes, by ledger type and kind
 * - ledger.rejections: domain rejections, by operation and error
 * - ledger.retries: lock-conflict retries, by operation
 * - ledger.storage.faults: operations that gave up on storage
 * - ledger.operation.duration: wall time of each executed operation
 * - loyalty.points.earned / loyalty.points.redeemed: point volume
 * - rewards.redeemed: successful reward redemptions
 * - audit.sink.failures: audit events that could not be recorded
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter pointsEarned;
    private final Counter pointsRedeemed;
    private final Counter rewardsRedeemed;
    private final Counter auditFailures;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pointsEarned = Counter.builder("loyalty.points.earned")
                .description("Loyalty points credited by purchases")
                .baseUnit("points")
                .register(registry);

        this.pointsRedeemed = Counter.builder("loyalty.points.redeemed")
                .description("Loyalty points debited by redemptions")
                .baseUnit("points")
                .register(registry);

        this.rewardsRedeemed = Counter.builder("rewards.redeemed")
                .description("Number of successful reward redemptions")
                .register(registry);

        this.auditFailures = Counter.builder("audit.sink.failures")
                .description("Audit events that could not be recorded")
                .register(registry);
    }

    public void recordMutation(LedgerType ledgerType, EntryKind kind) {
        registry.counter("ledger.mutations",
                "ledger", ledgerType.name().toLowerCase(),
                "kind", kind.dbValue()
        ).increment();
    }

    public void recordRejection(String operation, LedgerError error) {
        registry.counter("ledger.rejections",
                "operation", sanitizeTag(operation),
                "error", error.name().toLowerCase()
        ).increment();
    }

    public void recordRetry(String operation) {
        registry.counter("ledger.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordStorageFault(String operation) {
        registry.counter("ledger.storage.faults", "operation", sanitizeTag(operation)).increment();
    }

    public void recordOperationDuration(String operation, String outcome, Duration duration) {
        Timer.builder("ledger.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordPointsEarned(long points) {
        pointsEarned.increment(points);
    }

    public void recordPointsRedeemed(long points) {
        pointsRedeemed.increment(points);
    }

    public void recordRewardRedeemed() {
        rewardsRedeemed.increment();
    }

    public void recordAuditFailure() {
        auditFailures.increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.\\-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
