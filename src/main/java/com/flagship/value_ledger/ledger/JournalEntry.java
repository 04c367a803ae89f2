package com.flagship.value_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one balance change.
 *
 * Positive delta is a credit, negative a debit. referenceId, when present, is the
 * idempotency key: unique per (accountId, kind).
 */
@Value
public class JournalEntry {
    UUID id;
    UUID accountId;
    long delta;
    EntryKind kind;
    String source;
    String referenceId;
    String description;
    Instant expiresAt;
    Instant createdAt;
    Long sequenceNumber;
}
