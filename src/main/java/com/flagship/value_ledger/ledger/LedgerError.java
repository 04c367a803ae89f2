package com.flagship.value_ledger.ledger;

/**
 * Domain failures returned to callers as part of a {@link LedgerResult}.
 *
 * None of these leave a partial mutation behind: the surrounding transaction
 * is rolled back before the result is produced.
 */
public enum LedgerError {
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_POINTS,
    /**
     * The (account, kind, referenceId) triple was already journaled.
     * Callers treat this as a benign no-op.
     */
    DUPLICATE_OPERATION,
    REWARD_UNAVAILABLE,
    REWARD_EXPIRED,
    REWARD_EXHAUSTED,
    NOT_FOUND,
    ACCOUNT_NOT_FOUND,
    LIMIT_EXCEEDED,
    /**
     * A refund asked for another amount than the one journaled for the payment.
     */
    REFUND_AMOUNT_MISMATCH,
    VOUCHER_UNAVAILABLE,
    VOUCHER_EXHAUSTED
}
