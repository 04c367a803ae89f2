package com.flagship.value_ledger.wallet;

import lombok.Value;

/**
 * Limit usage snapshot. remaining is never negative.
 */
@Value
public class WalletLimits {
    Usage daily;
    Usage monthly;
    Usage balance;

    @Value
    public static class Usage {
        long limit;
        long used;

        public long getRemaining() {
            return Math.max(0, limit - used);
        }
    }
}
