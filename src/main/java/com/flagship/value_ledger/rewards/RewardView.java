package com.flagship.value_ledger.rewards;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A reward as seen by one member: catalog data plus whether their current
 * points balance covers it.
 */
@Value
@Builder
public class RewardView {
    UUID id;
    UUID merchantId;
    String name;
    String description;
    String rewardType;
    Long value;
    long pointsRequired;
    Integer quantity;
    int redeemedCount;
    Integer availableQuantity;
    Instant validUntil;
    String status;
    boolean expired;
    boolean exhausted;
    boolean canRedeem;
    long userPointsBalance;
    long pointsNeeded;

    static RewardView of(Reward reward, long pointsBalance, Instant now) {
        return RewardView.builder()
                .id(reward.getId())
                .merchantId(reward.getMerchantId())
                .name(reward.getName())
                .description(reward.getDescription())
                .rewardType(reward.getRewardType().dbValue())
                .value(reward.getValue())
                .pointsRequired(reward.getPointsRequired())
                .quantity(reward.getQuantity())
                .redeemedCount(reward.getRedeemedCount())
                .availableQuantity(reward.getAvailableQuantity())
                .validUntil(reward.getValidUntil())
                .status(reward.getStatus().dbValue())
                .expired(reward.isExpiredAt(now))
                .exhausted(reward.isExhausted())
                .canRedeem(reward.isRedeemableAt(now) && pointsBalance >= reward.getPointsRequired())
                .userPointsBalance(pointsBalance)
                .pointsNeeded(Math.max(0, reward.getPointsRequired() - pointsBalance))
                .build();
    }
}
