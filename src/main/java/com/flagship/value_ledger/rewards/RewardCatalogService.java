package com.flagship.value_ledger.rewards;

import com.flagship.value_ledger.audit.AuditEvent;
import com.flagship.value_ledger.audit.AuditPublisher;
import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.LedgerAccount;
import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerRejection;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.ledger.LedgerService;
import com.flagship.value_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.value_ledger.ledger.LedgerType;
import com.flagship.value_ledger.ledger.MutationRequest;
import com.flagship.value_ledger.ledger.MutationResult;
import com.flagship.value_ledger.ledger.ResultPage;
import com.flagship.value_ledger.ledger.TransactionHooks;
import com.flagship.value_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Reward catalog with bounded inventory, paid for in loyalty points.
 *
 * A redemption locks the reward row first and the member's points account
 * second, then debits the points, bumps the redeemed count and records the
 * redemption in one transaction. Holding the reward lock is what keeps the
 * number of successful redemptions within the reward's quantity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardCatalogService {

    static final String AUDIT_TARGET_TYPE = "reward";
    static final int MAX_CODE_ATTEMPTS = 5;

    private final RewardRepository rewardRepository;
    private final LedgerService ledgerService;
    private final LedgerTransactionExecutor executor;
    private final RedemptionCodeGenerator codeGenerator;
    private final AuditPublisher auditPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if the reward definition is malformed
     */
    @Transactional
    public Reward createReward(NewReward definition) {
        definition.validate();
        Reward reward = new Reward(
                UUID.randomUUID(),
                definition.getMerchantId(),
                definition.getName(),
                definition.getDescription(),
                definition.getRewardType(),
                definition.getValue(),
                definition.getPointsRequired(),
                definition.getQuantity(),
                0,
                RewardStatus.ACTIVE,
                definition.getValidUntil(),
                Instant.now(clock));
        rewardRepository.insert(reward);

        auditPublisher.publishAfterCommit(rewardEvent("REWARD_CREATED", reward,
                definition.getMerchantId() != null ? definition.getMerchantId().toString() : "system",
                "Reward created: " + reward.getName()));
        log.info("Reward created: rewardId={}, name={}, pointsRequired={}, quantity={}",
                reward.getId(), reward.getName(), reward.getPointsRequired(), reward.getQuantity());
        return reward;
    }

    public LedgerResult<Reward> deactivate(UUID rewardId) {
        return executor.execute("reward.deactivate", () -> {
            Reward reward = rewardRepository.lockById(rewardId)
                    .orElseThrow(() -> notFound(rewardId));
            if (!reward.getStatus().canTransitionTo(RewardStatus.INACTIVE)) {
                throw new LedgerRejection(LedgerError.REWARD_UNAVAILABLE,
                        "Reward " + rewardId + " is already " + reward.getStatus().dbValue());
            }
            Reward inactive = reward.deactivate();
            rewardRepository.updateState(inactive);
            auditPublisher.publishAfterCommit(rewardEvent("REWARD_DEACTIVATED", inactive, "system",
                    "Reward deactivated: " + inactive.getName()));
            return inactive;
        });
    }

    public LedgerResult<RewardView> getReward(UUID userId, UUID rewardId) {
        return rewardRepository.findById(rewardId)
                .map(reward -> LedgerResult.success(RewardView.of(reward, pointsBalance(userId), Instant.now(clock))))
                .orElseGet(() -> LedgerResult.failure(LedgerError.NOT_FOUND, "Reward not found: " + rewardId));
    }

    /**
     * Redeemable rewards, cheapest first. Page is 1-based.
     */
    @Transactional(readOnly = true)
    public ResultPage<RewardView> listAvailable(UUID userId, RewardType type, UUID merchantId, int page, int size) {
        if (page < 1 || size < 1) {
            throw new IllegalArgumentException("page and size must be positive");
        }
        Instant now = Instant.now(clock);
        long balance = pointsBalance(userId);
        long total = rewardRepository.countAvailable(now, type, merchantId);
        List<RewardView> items = rewardRepository.findAvailable(now, type, merchantId, size, (long) (page - 1) * size)
                .stream()
                .map(reward -> RewardView.of(reward, balance, now))
                .toList();
        return new ResultPage<>(items, page, size, total);
    }

    public LedgerResult<RedemptionResult> redeemReward(UUID userId, UUID rewardId) {
        LedgerResult<RedemptionResult> result = executor.execute("reward.redeem", () -> {
            Instant now = Instant.now(clock);
            Reward reward = rewardRepository.lockById(rewardId)
                    .orElseThrow(() -> notFound(rewardId));
            reward.requireRedeemableAt(now);

            LedgerAccount account = ledgerService.lockOrCreate(userId, LedgerType.POINTS);
            if (account.getBalance() < reward.getPointsRequired()) {
                throw new LedgerRejection(LedgerError.INSUFFICIENT_POINTS, String.format(
                        "Insufficient points. You need %d more points.",
                        reward.getPointsRequired() - account.getBalance()));
            }

            UUID redemptionId = UUID.randomUUID();
            MutationResult debit = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(-reward.getPointsRequired())
                    .kind(EntryKind.REDEEM)
                    .source("reward")
                    .referenceId("reward:" + rewardId + ":" + redemptionId)
                    .description("Redeemed reward: " + reward.getName())
                    .build());

            Reward redeemed = reward.recordRedemption();
            rewardRepository.updateState(redeemed);
            String code = recordRedemption(redemptionId, reward, userId, account, debit, now);

            auditPublisher.publishAfterCommit(AuditEvent.builder()
                    .eventId(UUID.randomUUID())
                    .action("LOYALTY_REWARD_REDEEMED")
                    .actorId(userId.toString())
                    .actorType("user")
                    .targetType(AUDIT_TARGET_TYPE)
                    .targetId(rewardId)
                    .description("Redeemed reward: " + reward.getName() + " for " + reward.getPointsRequired() + " points")
                    .metadataEntry("redemptionId", redemptionId.toString())
                    .metadataEntry("redemptionCode", code)
                    .metadataEntry("pointsSpent", reward.getPointsRequired())
                    .metadataEntry("redeemedCount", redeemed.getRedeemedCount())
                    .metadataEntry("status", redeemed.getStatus().dbValue())
                    .occurredAt(now)
                    .build());
            TransactionHooks.afterCommit(() -> {
                metrics.recordRewardRedeemed();
                metrics.recordPointsRedeemed(reward.getPointsRequired());
            });

            if (redeemed.getStatus() == RewardStatus.EXHAUSTED) {
                log.info("Reward exhausted: rewardId={}, quantity={}", rewardId, redeemed.getQuantity());
            }

            return new RedemptionResult(
                    redemptionId,
                    code,
                    rewardId,
                    reward.getName(),
                    reward.getRewardType().dbValue(),
                    reward.getPointsRequired(),
                    debit.getNewBalance(),
                    reward.getRewardType().instructions(code));
        });

        if (result.isSuccess()) {
            log.info("Reward redeemed: userId={}, rewardId={}, code={}",
                    userId, rewardId, result.getValue().getRedemptionCode());
        }
        return result;
    }

    /**
     * Inserts the redemption under a fresh code, drawing another code when the generated one is taken.
     *
     * @return the code the redemption was stored under
     */
    private String recordRedemption(UUID redemptionId, Reward reward, UUID userId, LedgerAccount account,
                                    MutationResult debit, Instant now) {
        for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
            String code = codeGenerator.next();
            boolean stored = rewardRepository.insertRedemption(new RewardRedemption(
                    redemptionId, reward.getId(), userId, account.getId(), debit.getJournalEntryId(),
                    code, reward.getPointsRequired(), now));
            if (stored) {
                return code;
            }
            log.warn("Redemption code collision: rewardId={}, attempt={}", reward.getId(), attempt);
        }
        throw new IllegalStateException("No free redemption code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    private long pointsBalance(UUID userId) {
        return ledgerService.findAccount(userId, LedgerType.POINTS)
                .map(LedgerAccount::getBalance)
                .orElse(0L);
    }

    private static LedgerRejection notFound(UUID rewardId) {
        return new LedgerRejection(LedgerError.NOT_FOUND, "Reward not found: " + rewardId);
    }

    private AuditEvent rewardEvent(String action, Reward reward, String actorId, String description) {
        return AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .action(action)
                .actorId(actorId)
                .actorType("catalog_owner")
                .targetType(AUDIT_TARGET_TYPE)
                .targetId(reward.getId())
                .description(description)
                .metadataEntry("pointsRequired", reward.getPointsRequired())
                .metadataEntry("quantity", reward.getQuantity() != null ? reward.getQuantity() : "unlimited")
                .metadataEntry("status", reward.getStatus().dbValue())
                .occurredAt(Instant.now(clock))
                .build();
    }
}
