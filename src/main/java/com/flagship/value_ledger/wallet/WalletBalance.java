package com.flagship.value_ledger.wallet;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class WalletBalance {
    long balance;
    long lifetimeInflow;
    Instant updatedAt;
}
