package com.flagship.value_ledger.loyalty;

import lombok.Value;

import java.util.UUID;

@Value
public class MerchantRedemptionResult {
    UUID journalEntryId;
    UUID merchantId;
    UUID customerId;
    long pointsRedeemed;
    long discountValue;
    long customerNewBalance;
}
