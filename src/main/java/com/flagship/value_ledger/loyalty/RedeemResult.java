package com.flagship.value_ledger.loyalty;

import lombok.Value;

/**
 * Points converted into wallet currency. valueReceived is in minor currency units.
 */
@Value
public class RedeemResult {
    long pointsRedeemed;
    long valueReceived;
    long newPointsBalance;
    long newCurrencyBalance;
}
