package com.flagship.value_ledger.observability;

import com.flagship.value_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the audit outbox backlog. A growing backlog means the publisher
 * cannot reach Kafka; ledger writes are unaffected, so the worst state is WARNING
 * until the critical threshold is crossed.
 */
@Component("outboxHealth")
public class OutboxHealthIndicator implements HealthIndicator {

    private final OutboxEventRepository outboxRepository;
    private final long warningThreshold;
    private final long criticalThreshold;

    public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                 @Value("${outbox.health.warning-threshold:1000}") long warningThreshold,
                                 @Value("${outbox.health.critical-threshold:10000}") long criticalThreshold) {
        this.outboxRepository = outboxRepository;
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
    }

    @Override
    public Health health() {
        try {
            long backlog = outboxRepository.countUnpublished();
            Health.Builder builder = backlog < warningThreshold
                    ? Health.up()
                    : backlog < criticalThreshold ? Health.status("WARNING") : Health.down();
            return builder
                    .withDetail("backlogSize", backlog)
                    .withDetail("warningThreshold", warningThreshold)
                    .withDetail("criticalThreshold", criticalThreshold)
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
