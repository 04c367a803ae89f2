package com.flagship.value_ledger.loyalty.dto;

import com.flagship.value_ledger.loyalty.LoyaltyAccountService;
import com.flagship.value_ledger.loyalty.TierDefinition;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * The tier table plus the fixed earning and redemption rates.
 */
@Value
public class TierTableResponse {
    List<Tier> tiers;
    BigDecimal baseEarnRate;
    long pointValue;

    @Value
    public static class Tier {
        String code;
        String name;
        long minPoints;
        Long maxPoints;
        BigDecimal earnMultiplier;
        List<String> benefits;
    }

    public static TierTableResponse from(List<TierDefinition> table) {
        List<Tier> tiers = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            TierDefinition tier = table.get(i);
            Long max = i + 1 < table.size() ? table.get(i + 1).getMinTierPoints() - 1 : null;
            tiers.add(new Tier(tier.getCode(), tier.getName(), tier.getMinTierPoints(), max,
                    tier.getEarnMultiplier(), tier.getBenefits()));
        }
        return new TierTableResponse(tiers, LoyaltyAccountService.BASE_EARN_RATE, LoyaltyAccountService.POINT_VALUE);
    }
}
