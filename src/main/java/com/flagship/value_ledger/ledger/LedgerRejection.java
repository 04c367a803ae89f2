package com.flagship.value_ledger.ledger;

import lombok.Getter;

/**
 * Raised inside a ledger transaction to abort it with a domain error.
 *
 * Never escapes {@link LedgerTransactionExecutor}: the executor rolls the
 * transaction back and turns the rejection into a failed {@link LedgerResult}.
 */
@Getter
public class LedgerRejection extends RuntimeException {

    private final LedgerError error;

    public LedgerRejection(LedgerError error, String message) {
        super(message);
        this.error = error;
    }
}
