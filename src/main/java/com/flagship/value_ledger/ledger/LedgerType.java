package com.flagship.value_ledger.ledger;

/**
 * The two ledgers every user owns.
 * Both are stored in the same table and mutated by the same primitive;
 * only the rejection reported for an overdraft differs.
 */
public enum LedgerType {
    /**
     * Monetary wallet, balance in minor currency units.
     */
    CURRENCY,

    /**
     * Loyalty points wallet, carries tier points and a cached tier label.
     */
    POINTS;

    public LedgerError insufficientFundsError() {
        return this == POINTS ? LedgerError.INSUFFICIENT_POINTS : LedgerError.INSUFFICIENT_BALANCE;
    }
}
