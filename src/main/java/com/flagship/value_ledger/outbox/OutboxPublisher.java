package com.flagship.value_ledger.outbox;

import com.flagship.value_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and ships pending events to the ledger audit topic.
 *
 * Events are sent one at a time and acknowledged before being marked published,
 * so per-aggregate order is kept (the aggregate id is the record key). An event
 * that keeps failing is retried on later polls until it reaches
 * {@code outbox.publisher.max-retries}; after that it stays in the table as a
 * dead letter.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event-type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-audit:ledger-audit}")
    private String auditTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPending() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.lockPublishableBatch(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }
        log.debug("Publishing {} outbox events", batch.size());
        batch.forEach(this::publish);
    }

    private void publish(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(auditTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published outbox event: eventId={}, partition={}, offset={}",
                    event.getId(), result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            int attempts = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (attempts >= maxRetries) {
                log.error("Outbox event dead-lettered after {} attempts: eventId={}, eventType={}, aggregateId={}",
                        attempts, event.getId(), event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
