package com.flagship.value_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Input of the ledger mutation primitive.
 *
 * tierPointsDelta is applied in the same update as delta; it is only
 * non-zero for loyalty accruals.
 */
@Value
@Builder
public class MutationRequest {
    UUID accountId;
    long delta;
    EntryKind kind;
    String source;
    String referenceId;
    String description;
    Instant expiresAt;
    @Builder.Default
    long tierPointsDelta = 0;

    /**
     * Validates the shape of the request (not the balance precondition).
     *
     * @throws IllegalArgumentException on a malformed request
     */
    public void validate() {
        Objects.requireNonNull(accountId, "accountId is required");
        Objects.requireNonNull(kind, "kind is required");
        if (!kind.permits(delta)) {
            throw new IllegalArgumentException(
                String.format("Delta %d has the wrong sign for a %s entry", delta, kind.dbValue()));
        }
        if (referenceId != null && referenceId.isBlank()) {
            throw new IllegalArgumentException("referenceId must not be blank when supplied");
        }
        if (tierPointsDelta < 0) {
            throw new IllegalArgumentException("tierPointsDelta must not be negative");
        }
    }
}
