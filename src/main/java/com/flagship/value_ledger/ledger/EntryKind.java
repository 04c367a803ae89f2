package com.flagship.value_ledger.ledger;

import java.util.Locale;

/**
 * Kind of a journal entry.
 *
 * Each kind fixes the sign of its delta, except ADJUST which may go either way.
 * Stored in lower case ("earn", "topup", ...).
 */
public enum EntryKind {
    EARN(Direction.CREDIT),
    REDEEM(Direction.DEBIT),
    EXPIRE(Direction.DEBIT),
    ADJUST(Direction.EITHER),
    BONUS(Direction.CREDIT),
    PAYMENT(Direction.DEBIT),
    REFUND(Direction.CREDIT),
    TOPUP(Direction.CREDIT);

    private final Direction direction;

    EntryKind(Direction direction) {
        this.direction = direction;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EntryKind fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /**
     * Checks that the sign of a delta matches this kind. Zero is accepted for every kind.
     */
    public boolean permits(long delta) {
        return switch (direction) {
            case CREDIT -> delta >= 0;
            case DEBIT -> delta <= 0;
            case EITHER -> true;
        };
    }

    private enum Direction {
        CREDIT,
        DEBIT,
        EITHER
    }
}
