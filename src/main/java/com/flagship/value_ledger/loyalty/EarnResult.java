package com.flagship.value_ledger.loyalty;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class EarnResult {
    UUID journalEntryId;
    long earnedPoints;
    long basePoints;
    BigDecimal multiplier;
    long newBalance;
    long newTierPoints;
    String newTier;
    boolean tierChanged;
    Instant expiresAt;
}
