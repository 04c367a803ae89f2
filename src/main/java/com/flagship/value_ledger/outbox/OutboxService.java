package com.flagship.value_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox table and tracks their delivery.
 *
 * Events are appended in a transaction of their own: audit events are raised
 * after the ledger transaction committed, so there is nothing left to join.
 * Shipping to Kafka is done by {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param aggregateType kind of ledger object, e.g. "ledger_account" or "reward"
     * @param aggregateId   id of that object, used as the Kafka key
     * @param eventType     action name, e.g. "LEDGER_EARN"
     * @param payload       serialized to JSON
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OutboxEvent appendEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.pending(aggregateType, aggregateId, eventType,
                toJson(payload), Instant.now(clock));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.of(event));

        log.debug("Appended outbox event: eventType={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);
        return saved.toEvent();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> lockPublishableBatch(int limit, int maxRetries) {
        return repository.lockPublishableBatch(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.markPublished(Instant.now(clock)));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId)
                .map(entity -> {
                    entity.markFailed(errorMessage);
                    log.warn("Outbox event {} failed (attempt #{}): {}",
                            eventId, entity.getRetryCount(), errorMessage);
                    return entity.getRetryCount();
                })
                .orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsFor(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Outbox payload is not serializable: "
                    + payload.getClass().getSimpleName(), e);
        }
    }
}
