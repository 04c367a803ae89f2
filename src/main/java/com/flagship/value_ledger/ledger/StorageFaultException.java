package com.flagship.value_ledger.ledger;

/**
 * Unexpected storage failure, or a lock conflict that persisted through every retry.
 * Not recoverable by the ledger itself.
 */
public class StorageFaultException extends RuntimeException {

    public StorageFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
