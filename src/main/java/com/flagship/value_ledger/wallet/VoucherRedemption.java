package com.flagship.value_ledger.wallet;

import lombok.Value;

import java.util.UUID;

@Value
public class VoucherRedemption {
    UUID voucherId;
    String voucherName;
    UUID journalEntryId;
    long amount;
    long newBalance;
}
