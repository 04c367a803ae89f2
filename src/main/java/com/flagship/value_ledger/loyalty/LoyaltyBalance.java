package com.flagship.value_ledger.loyalty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Display view of a points account. Cached, so it must stay JSON round-trippable.
 */
@Value
@Builder
@Jacksonized
public class LoyaltyBalance {
    long pointsBalance;
    long lifetimePoints;
    String tier;
    String tierName;
    long tierPoints;
    BigDecimal earnMultiplier;
    String nextTier;
    String nextTierName;
    Long pointsToNext;
    List<String> benefits;
}
