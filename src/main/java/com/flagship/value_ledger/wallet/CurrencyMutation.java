package com.flagship.value_ledger.wallet;

import lombok.Value;

import java.util.UUID;

@Value
public class CurrencyMutation {
    UUID journalEntryId;
    String kind;
    long delta;
    long newBalance;
}
