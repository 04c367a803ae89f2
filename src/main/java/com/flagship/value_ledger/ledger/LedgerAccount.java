package com.flagship.value_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a balance-bearing account.
 *
 * Invariant: balance >= 0, and balance equals the sum of the account's journal deltas.
 * lifetimeInflow only ever grows (sum of positive deltas). tierPoints and tier are
 * meaningful on the POINTS ledger only.
 */
@Value
public class LedgerAccount {
    UUID id;
    UUID ownerId;
    LedgerType ledgerType;
    long balance;
    long lifetimeInflow;
    long tierPoints;
    String tier;
    Instant createdAt;
    Instant updatedAt;
    Instant archivedAt;

    public boolean isArchived() {
        return archivedAt != null;
    }
}
