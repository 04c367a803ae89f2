package com.flagship.value_ledger.wallet;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Charge (top-up) limits of a currency wallet, in minor units. Daily and
 * monthly windows are calendar days and months in UTC.
 */
@Component
@Getter
public class WalletLimitPolicy {

    private final long dailyLimit;
    private final long monthlyLimit;
    private final long maxBalance;

    public WalletLimitPolicy(@Value("${ledger.wallet.daily-limit:500000}") long dailyLimit,
                             @Value("${ledger.wallet.monthly-limit:2000000}") long monthlyLimit,
                             @Value("${ledger.wallet.max-balance:3000000}") long maxBalance) {
        if (dailyLimit <= 0 || monthlyLimit <= 0 || maxBalance <= 0) {
            throw new IllegalArgumentException("Wallet limits must be positive");
        }
        this.dailyLimit = dailyLimit;
        this.monthlyLimit = monthlyLimit;
        this.maxBalance = maxBalance;
    }
}
