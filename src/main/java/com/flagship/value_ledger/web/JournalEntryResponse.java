package com.flagship.value_ledger.web;

import com.flagship.value_ledger.ledger.JournalEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {
    UUID id;
    long delta;
    String kind;
    String source;
    String referenceId;
    String description;
    Instant expiresAt;
    Instant createdAt;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
                .id(entry.getId())
                .delta(entry.getDelta())
                .kind(entry.getKind().dbValue())
                .source(entry.getSource())
                .referenceId(entry.getReferenceId())
                .description(entry.getDescription())
                .expiresAt(entry.getExpiresAt())
                .createdAt(entry.getCreatedAt())
                .build();
    }
}
