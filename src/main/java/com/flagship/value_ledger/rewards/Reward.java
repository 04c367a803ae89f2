package com.flagship.value_ledger.rewards;

import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerRejection;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.UUID;

/**
 * Catalog reward with optional bounded inventory.
 *
 * Invariant: when quantity is set, redeemedCount never exceeds it, and the
 * redemption that reaches it flips the status to EXHAUSTED.
 */
@Value
public class Reward {
    UUID id;
    UUID merchantId;
    String name;
    String description;
    RewardType rewardType;
    Long value;
    long pointsRequired;
    Integer quantity;
    @With
    int redeemedCount;
    @With
    RewardStatus status;
    Instant validUntil;
    Instant createdAt;

    public boolean isExpiredAt(Instant now) {
        return validUntil != null && validUntil.isBefore(now);
    }

    public boolean isExhausted() {
        return quantity != null && redeemedCount >= quantity;
    }

    /**
     * Remaining inventory, null when unlimited.
     */
    public Integer getAvailableQuantity() {
        return quantity == null ? null : Math.max(0, quantity - redeemedCount);
    }

    public boolean isRedeemableAt(Instant now) {
        return status == RewardStatus.ACTIVE && !isExpiredAt(now) && !isExhausted();
    }

    /**
     * @throws LedgerRejection REWARD_UNAVAILABLE when deactivated, REWARD_EXPIRED, or
     *                         REWARD_EXHAUSTED when no quantity is left; checked in that order
     */
    public void requireRedeemableAt(Instant now) {
        if (status == RewardStatus.INACTIVE) {
            throw new LedgerRejection(LedgerError.REWARD_UNAVAILABLE, "Reward " + id + " is " + status.dbValue());
        }
        if (isExpiredAt(now)) {
            throw new LedgerRejection(LedgerError.REWARD_EXPIRED, "Reward " + id + " expired at " + validUntil);
        }
        if (status == RewardStatus.EXHAUSTED || isExhausted()) {
            throw new LedgerRejection(LedgerError.REWARD_EXHAUSTED, "Reward " + id + " has no quantity left");
        }
    }

    /**
     * State after one more redemption.
     *
     * @throws IllegalStateException if the reward is not active or has no quantity left
     */
    public Reward recordRedemption() {
        if (status != RewardStatus.ACTIVE || isExhausted()) {
            throw new IllegalStateException("Reward " + id + " cannot be redeemed in state " + status);
        }
        Reward next = withRedeemedCount(redeemedCount + 1);
        return next.isExhausted() ? next.withStatus(RewardStatus.EXHAUSTED) : next;
    }

    /**
     * @throws IllegalStateException if the reward already left ACTIVE
     */
    public Reward deactivate() {
        if (!status.canTransitionTo(RewardStatus.INACTIVE)) {
            throw new IllegalStateException("Reward " + id + " is already " + status.dbValue());
        }
        return withStatus(RewardStatus.INACTIVE);
    }
}
