package com.flagship.value_ledger.loyalty;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * One row of the tier table. A tier covers tier points from its
 * minTierPoints (inclusive) up to the next tier's minimum (exclusive).
 */
@Value
public class TierDefinition {
    String code;
    String name;
    long minTierPoints;
    BigDecimal earnMultiplier;
    List<String> benefits;
}
