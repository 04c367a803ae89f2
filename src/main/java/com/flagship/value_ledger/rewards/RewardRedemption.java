package com.flagship.value_ledger.rewards;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Links a reward redemption to the points journal entry that paid for it.
 */
@Value
public class RewardRedemption {
    UUID id;
    UUID rewardId;
    UUID userId;
    UUID accountId;
    UUID journalEntryId;
    String redemptionCode;
    long pointsSpent;
    Instant createdAt;
}
