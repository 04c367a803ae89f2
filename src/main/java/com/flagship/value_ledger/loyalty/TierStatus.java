package com.flagship.value_ledger.loyalty;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Tier that applies to a tier-point value, with the distance to the next one.
 * nextTier and pointsToNext are null at the top tier.
 */
@Value
public class TierStatus {
    TierDefinition tier;
    TierDefinition nextTier;
    Long pointsToNext;

    public BigDecimal getEarnMultiplier() {
        return tier.getEarnMultiplier();
    }

    public boolean isTopTier() {
        return nextTier == null;
    }
}
