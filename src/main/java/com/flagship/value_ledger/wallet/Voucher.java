package com.flagship.value_ledger.wallet;

import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerRejection;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * Code that tops up the wallet by a fixed amount, usable a limited number of
 * times overall and once per user.
 *
 * Invariant: usageCount never exceeds usageLimit.
 */
@Value
public class Voucher {
    UUID id;
    String code;
    String name;
    long amount;
    int usageLimit;
    @With
    int usageCount;
    VoucherStatus status;
    Instant validFrom;
    Instant validUntil;
    Instant createdAt;

    public boolean isValidAt(Instant now) {
        return !now.isBefore(validFrom) && !now.isAfter(validUntil);
    }

    public boolean isUsedUp() {
        return usageCount >= usageLimit;
    }

    /**
     * @throws LedgerRejection VOUCHER_UNAVAILABLE when inactive or outside its validity window,
     *                         VOUCHER_EXHAUSTED when the usage limit is reached; checked in that order
     */
    public void requireUsableAt(Instant now) {
        if (status != VoucherStatus.ACTIVE) {
            throw new LedgerRejection(LedgerError.VOUCHER_UNAVAILABLE, "Voucher " + code + " is " + status.dbValue());
        }
        if (!isValidAt(now)) {
            throw new LedgerRejection(LedgerError.VOUCHER_UNAVAILABLE, "Voucher " + code + " is not valid at this time");
        }
        if (isUsedUp()) {
            throw new LedgerRejection(LedgerError.VOUCHER_EXHAUSTED, "Voucher " + code + " usage limit reached");
        }
    }

    /**
     * @throws IllegalStateException if the usage limit is already reached
     */
    public Voucher recordUse() {
        if (isUsedUp()) {
            throw new IllegalStateException("Voucher " + code + " has no uses left");
        }
        return withUsageCount(usageCount + 1);
    }
}
