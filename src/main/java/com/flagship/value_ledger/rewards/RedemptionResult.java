package com.flagship.value_ledger.rewards;

import lombok.Value;

import java.util.UUID;

@Value
public class RedemptionResult {
    UUID redemptionId;
    String redemptionCode;
    UUID rewardId;
    String rewardName;
    String rewardType;
    long pointsSpent;
    long newPointsBalance;
    String instructions;
}
