package com.flagship.value_ledger.rewards;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class NewReward {
    UUID merchantId;
    String name;
    String description;
    RewardType rewardType;
    Long value;
    long pointsRequired;
    Integer quantity;
    Instant validUntil;

    /**
     * @throws IllegalArgumentException on a malformed reward
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Reward name is required");
        }
        if (rewardType == null) {
            throw new IllegalArgumentException("Reward type is required");
        }
        if (pointsRequired <= 0) {
            throw new IllegalArgumentException("pointsRequired must be positive");
        }
        if (quantity != null && quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive when set");
        }
        if (value != null && value < 0) {
            throw new IllegalArgumentException("value must not be negative");
        }
    }
}
