package com.flagship.value_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Post-mutation state of an account, so callers never need a second read.
 */
@Value
public class MutationResult {
    UUID accountId;
    UUID journalEntryId;
    long delta;
    long newBalance;
    long newLifetimeInflow;
    long newTierPoints;
}
