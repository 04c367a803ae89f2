package com.flagship.value_ledger.audit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured record of one ledger action, handed to the {@link AuditSink}.
 */
@Value
@Builder
public class AuditEvent {
    UUID eventId;
    String action;
    String actorId;
    String actorType;
    String targetType;
    UUID targetId;
    String description;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
    Instant occurredAt;
}
