package com.flagship.value_ledger.wallet;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class NewVoucher {
    String code;
    String name;
    long amount;
    int usageLimit;
    Instant validFrom;
    Instant validUntil;

    /**
     * @throws IllegalArgumentException on a malformed voucher
     */
    public void validate() {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Voucher code is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Voucher name is required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Voucher amount must be positive");
        }
        if (usageLimit <= 0) {
            throw new IllegalArgumentException("usageLimit must be positive");
        }
        if (validFrom == null || validUntil == null || !validFrom.isBefore(validUntil)) {
            throw new IllegalArgumentException("validFrom must be before validUntil");
        }
    }
}
