package com.flagship.value_ledger.loyalty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Maps accumulated tier points to a loyalty tier.
 *
 * The table must start at 0 and have strictly increasing minimums, so every
 * non-negative tier-point value falls in exactly one tier. A value equal to a
 * tier's minimum belongs to that tier. Stateless and thread-safe.
 */
public final class TierEngine {

    private final List<TierDefinition> tiers;

    public TierEngine(List<TierDefinition> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Tier table must not be empty");
        }
        if (tiers.get(0).getMinTierPoints() != 0) {
            throw new IllegalArgumentException("Lowest tier must start at 0 tier points");
        }
        for (int i = 0; i < tiers.size(); i++) {
            TierDefinition tier = tiers.get(i);
            if (tier.getEarnMultiplier() == null || tier.getEarnMultiplier().compareTo(BigDecimal.ONE) < 0) {
                throw new IllegalArgumentException("Earn multiplier of " + tier.getCode() + " must be at least 1.0");
            }
            if (i > 0 && tier.getMinTierPoints() <= tiers.get(i - 1).getMinTierPoints()) {
                throw new IllegalArgumentException("Tier minimums must be strictly increasing at " + tier.getCode());
            }
        }
        this.tiers = List.copyOf(tiers);
    }

    public static TierEngine standardTiers() {
        return new TierEngine(List.of(
            new TierDefinition("bronze", "Bronze", 0, new BigDecimal("1.0"), List.of(
                "Basic points earning (1 point per 100 KRW)",
                "Access to standard rewards")),
            new TierDefinition("silver", "Silver", 10_000, new BigDecimal("1.1"), List.of(
                "10% bonus points on all purchases",
                "Priority customer support",
                "Early access to promotions")),
            new TierDefinition("gold", "Gold", 50_000, new BigDecimal("1.25"), List.of(
                "25% bonus points on all purchases",
                "Free delivery on orders over 30,000 KRW",
                "Exclusive member discounts",
                "Birthday bonus points")),
            new TierDefinition("platinum", "Platinum", 100_000, new BigDecimal("1.5"), List.of(
                "50% bonus points on all purchases",
                "Free delivery on all orders",
                "VIP customer service",
                "Special event invitations",
                "Double points on weekends")),
            new TierDefinition("diamond", "Diamond", 200_000, new BigDecimal("2.0"), List.of(
                "100% bonus points on all purchases",
                "Unlimited free delivery",
                "Dedicated account manager",
                "Exclusive Diamond-only rewards",
                "First access to new merchants",
                "Annual anniversary gift"))
        ));
    }

    /**
     * @throws IllegalArgumentException if tierPoints is negative
     */
    public TierStatus tierFor(long tierPoints) {
        if (tierPoints < 0) {
            throw new IllegalArgumentException("Tier points must not be negative: " + tierPoints);
        }
        int index = 0;
        while (index + 1 < tiers.size() && tiers.get(index + 1).getMinTierPoints() <= tierPoints) {
            index++;
        }
        TierDefinition current = tiers.get(index);
        if (index + 1 == tiers.size()) {
            return new TierStatus(current, null, null);
        }
        TierDefinition next = tiers.get(index + 1);
        return new TierStatus(current, next, next.getMinTierPoints() - tierPoints);
    }

    public List<TierDefinition> tiers() {
        return tiers;
    }

    public TierDefinition lowest() {
        return tiers.get(0);
    }

    public Optional<TierDefinition> byCode(String code) {
        return tiers.stream().filter(tier -> tier.getCode().equals(code)).findFirst();
    }
}
