package com.flagship.value_ledger.ledger;

import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Defers side effects until the surrounding transaction has committed.
 * Without an active transaction the action runs immediately.
 * Actions never run for a rolled-back transaction.
 */
public final class TransactionHooks {

    private TransactionHooks() {
        // Utility class
    }

    public static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
