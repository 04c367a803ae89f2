package com.flagship.value_ledger.loyalty;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Program overview for operators. Outstanding points are the program's
 * liability in minor currency units (1 point = 1 unit).
 */
@Value
@Builder
public class LoyaltyStatistics {
    long totalAccounts;
    long pointsOutstanding;
    long lifetimePointsEarned;
    long averageBalance;
    Map<String, Long> tierDistribution;
    int activityWindowDays;
    List<KindActivity> recentActivity;
    List<RewardTypeActivity> rewardActivity;

    @Value
    public static class KindActivity {
        String kind;
        long entries;
        long points;
    }

    @Value
    public static class RewardTypeActivity {
        String rewardType;
        long rewards;
        long redemptions;
        long pointsSpent;
    }
}
