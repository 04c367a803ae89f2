package com.flagship.value_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Stored balance compared with the sum of the account's journal.
 */
@Value
public class ReconciliationReport {
    UUID accountId;
    long balance;
    long journalSum;
    long entryCount;

    public boolean isConsistent() {
        return balance == journalSum;
    }
}
