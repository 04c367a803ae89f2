package com.flagship.value_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already shipped from) the outbox.
 *
 * aggregateType/aggregateId name the ledger object the event is about
 * (e.g. "ledger_account" and the account id); the aggregate id is the Kafka key.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType,
                                      String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
