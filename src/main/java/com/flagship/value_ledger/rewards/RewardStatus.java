package com.flagship.value_ledger.rewards;

import java.util.Locale;

/**
 * Stored reward state. ACTIVE is the only state that allows redemption;
 * EXHAUSTED and INACTIVE are terminal. Expiry is not a state, it is
 * computed from validUntil.
 */
public enum RewardStatus {
    ACTIVE,
    EXHAUSTED,
    INACTIVE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RewardStatus fromDbValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public boolean canTransitionTo(RewardStatus target) {
        return this == ACTIVE && target != ACTIVE;
    }
}
