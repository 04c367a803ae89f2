package com.flagship.value_ledger.loyalty;

import com.flagship.value_ledger.audit.AuditEvent;
import com.flagship.value_ledger.audit.AuditPublisher;
import com.flagship.value_ledger.cache.BalanceCache;
import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.JournalEntry;
import com.flagship.value_ledger.ledger.LedgerAccount;
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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Loyalty points on top of the generic ledger: tier-multiplied accrual,
 * conversion of points into wallet currency, and merchant-side redemption.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoyaltyAccountService {

    /**
     * One point per 100 minor currency units spent.
     */
    public static final BigDecimal BASE_EARN_RATE = new BigDecimal("0.01");

    /**
     * Minor currency units received per redeemed point.
     */
    public static final long POINT_VALUE = 1;

    public static final long MIN_REDEMPTION_POINTS = 100;

    static final String DEFAULT_EARN_SOURCE = "payment";

    private final LedgerService ledgerService;
    private final LedgerTransactionExecutor executor;
    private final TierEngine tierEngine;
    private final BalanceCache balanceCache;
    private final AuditPublisher auditPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Credits points for a purchase. The points are multiplied by the tier the
     * account holds before the purchase; the purchase then counts toward the tier.
     *
     * @param amountSpent purchase amount in minor currency units
     * @param referenceId purchase identifier; a repeat yields DUPLICATE_OPERATION
     * @param source      origin of the purchase, "payment" when null
     */
    public LedgerResult<EarnResult> earn(UUID userId, long amountSpent, String referenceId, String source) {
        if (amountSpent <= 0) {
            throw new IllegalArgumentException("Amount spent must be positive");
        }
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("A purchase reference is required to earn points");
        }
        String effectiveSource = source != null && !source.isBlank() ? source : DEFAULT_EARN_SOURCE;

        LedgerResult<EarnResult> result = executor.execute("loyalty.earn", () -> {
            LedgerAccount account = ledgerService.lockOrCreate(userId, LedgerType.POINTS);
            TierStatus current = tierEngine.tierFor(account.getTierPoints());

            long basePoints = basePoints(amountSpent);
            long earnedPoints = multiply(basePoints, current.getEarnMultiplier());
            Instant expiresAt = OffsetDateTime.now(clock).plusYears(1).toInstant();

            MutationResult mutation = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(earnedPoints)
                    .kind(EntryKind.EARN)
                    .source(effectiveSource)
                    .referenceId(referenceId)
                    .description("Points earned from purchase of " + amountSpent)
                    .expiresAt(expiresAt)
                    .tierPointsDelta(earnedPoints)
                    .build());

            TierStatus reached = tierEngine.tierFor(mutation.getNewTierPoints());
            String newTier = reached.getTier().getCode();
            boolean tierChanged = !newTier.equals(account.getTier());
            if (tierChanged) {
                ledgerService.updateTier(account, newTier);
                auditPublisher.publishAfterCommit(tierChangedEvent(account, newTier, mutation.getNewTierPoints()));
                log.info("Loyalty tier changed: userId={}, {} -> {}, tierPoints={}",
                        userId, account.getTier(), newTier, mutation.getNewTierPoints());
            }

            TransactionHooks.afterCommit(() -> metrics.recordPointsEarned(earnedPoints));

            return new EarnResult(
                    mutation.getJournalEntryId(),
                    earnedPoints,
                    basePoints,
                    current.getEarnMultiplier(),
                    mutation.getNewBalance(),
                    mutation.getNewTierPoints(),
                    newTier,
                    tierChanged,
                    expiresAt);
        });

        if (result.isSuccess()) {
            log.info("Points earned: userId={}, referenceId={}, points={}, balance={}",
                    userId, referenceId, result.getValue().getEarnedPoints(), result.getValue().getNewBalance());
        }
        return result;
    }

    /**
     * Converts points into wallet currency. The points debit and the currency
     * credit commit together or not at all.
     *
     * @throws IllegalArgumentException if points is below {@link #MIN_REDEMPTION_POINTS}
     */
    public LedgerResult<RedeemResult> redeem(UUID userId, long points) {
        if (points < MIN_REDEMPTION_POINTS) {
            throw new IllegalArgumentException("Minimum " + MIN_REDEMPTION_POINTS + " points required for redemption");
        }
        long value = Math.multiplyExact(points, POINT_VALUE);

        return executor.execute("loyalty.redeem", () -> {
            LedgerAccount pointsAccount = ledgerService.lockOrCreate(userId, LedgerType.POINTS);
            MutationResult debit = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(pointsAccount.getId())
                    .delta(-points)
                    .kind(EntryKind.REDEEM)
                    .source("wallet")
                    .description("Redeemed " + points + " points for " + value)
                    .build());

            LedgerAccount currencyAccount = ledgerService.lockOrCreate(userId, LedgerType.CURRENCY);
            MutationResult credit = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(currencyAccount.getId())
                    .delta(value)
                    .kind(EntryKind.TOPUP)
                    .source("loyalty")
                    .referenceId("loyalty-redeem:" + debit.getJournalEntryId())
                    .description("Loyalty points redemption: " + points + " points")
                    .build());

            TransactionHooks.afterCommit(() -> metrics.recordPointsRedeemed(points));
            return new RedeemResult(points, value, debit.getNewBalance(), credit.getNewBalance());
        });
    }

    /**
     * Merchant accepts a customer's points as a discount.
     *
     * @throws IllegalArgumentException if points is not positive
     */
    public LedgerResult<MerchantRedemptionResult> merchantRedeem(UUID merchantId, UUID customerId,
                                                                 long points, String description) {
        if (points <= 0) {
            throw new IllegalArgumentException("Points must be positive");
        }
        long discountValue = Math.multiplyExact(points, POINT_VALUE);
        String text = description != null && !description.isBlank()
                ? description
                : "Points redeemed at merchant " + merchantId;

        return executor.execute("loyalty.merchant-redeem", () -> {
            LedgerAccount account = ledgerService.lockExisting(customerId, LedgerType.POINTS);
            MutationResult debit = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(-points)
                    .kind(EntryKind.REDEEM)
                    .source("merchant")
                    .description(text)
                    .build());

            auditPublisher.publishAfterCommit(AuditEvent.builder()
                    .eventId(UUID.randomUUID())
                    .action("MERCHANT_LOYALTY_REDEMPTION")
                    .actorId(merchantId.toString())
                    .actorType("merchant")
                    .targetType("ledger_account")
                    .targetId(account.getId())
                    .description("Merchant redeemed " + points + " points for customer")
                    .metadataEntry("merchantId", merchantId.toString())
                    .metadataEntry("customerId", customerId.toString())
                    .metadataEntry("points", points)
                    .metadataEntry("discountValue", discountValue)
                    .occurredAt(Instant.now(clock))
                    .build());
            TransactionHooks.afterCommit(() -> metrics.recordPointsRedeemed(points));

            return new MerchantRedemptionResult(debit.getJournalEntryId(), merchantId, customerId,
                    points, discountValue, debit.getNewBalance());
        });
    }

    public LoyaltyBalance getBalance(UUID userId) {
        return balanceCache.get(LedgerType.POINTS, userId, LoyaltyBalance.class)
                .orElseGet(() -> {
                    LoyaltyBalance balance = toBalance(ledgerService.getOrCreateAccount(userId, LedgerType.POINTS));
                    balanceCache.put(LedgerType.POINTS, userId, balance);
                    return balance;
                });
    }

    public ResultPage<JournalEntry> history(UUID userId, EntryKind kind, int page, int size) {
        LedgerAccount account = ledgerService.getOrCreateAccount(userId, LedgerType.POINTS);
        return ledgerService.history(account.getId(), kind, page, size);
    }

    static long basePoints(long amountSpent) {
        return BigDecimal.valueOf(amountSpent).multiply(BASE_EARN_RATE).setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    static long multiply(long points, BigDecimal multiplier) {
        return BigDecimal.valueOf(points).multiply(multiplier).setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    private LoyaltyBalance toBalance(LedgerAccount account) {
        TierStatus status = tierEngine.tierFor(account.getTierPoints());
        TierDefinition next = status.getNextTier();
        return LoyaltyBalance.builder()
                .pointsBalance(account.getBalance())
                .lifetimePoints(account.getLifetimeInflow())
                .tier(status.getTier().getCode())
                .tierName(status.getTier().getName())
                .tierPoints(account.getTierPoints())
                .earnMultiplier(status.getEarnMultiplier())
                .nextTier(next != null ? next.getCode() : null)
                .nextTierName(next != null ? next.getName() : null)
                .pointsToNext(status.getPointsToNext())
                .benefits(status.getTier().getBenefits())
                .build();
    }

    private AuditEvent tierChangedEvent(LedgerAccount account, String newTier, long tierPoints) {
        return AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .action("LOYALTY_TIER_CHANGED")
                .actorId(account.getOwnerId().toString())
                .actorType("user")
                .targetType("ledger_account")
                .targetId(account.getId())
                .description("Tier changed from " + account.getTier() + " to " + newTier)
                .metadataEntry("previousTier", account.getTier() != null ? account.getTier() : "")
                .metadataEntry("newTier", newTier)
                .metadataEntry("tierPoints", tierPoints)
                .occurredAt(Instant.now(clock))
                .build();
    }
}
