package com.flagship.value_ledger.wallet;

import com.flagship.value_ledger.cache.BalanceCache;
import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.JournalEntry;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Currency wallet operations on the generic ledger.
 *
 * Charges are limited per UTC day, per UTC month and by a maximum balance.
 * Usage is summed from the journal's charge entries while the account row is
 * locked, so two concurrent charges cannot both slip under a limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    static final Set<EntryKind> CURRENCY_KINDS =
            EnumSet.of(EntryKind.PAYMENT, EntryKind.REFUND, EntryKind.TOPUP, EntryKind.ADJUST);

    static final String CHARGE_SOURCE = "charge";

    private final LedgerService ledgerService;
    private final LedgerTransactionExecutor executor;
    private final WalletLimitPolicy limitPolicy;
    private final BalanceCache balanceCache;
    private final Clock clock;

    /**
     * Single currency-ledger mutation, used by the payment, refund, top-up and delivery flows.
     *
     * @throws IllegalArgumentException if kind is not a currency kind or the delta sign does not match it
     */
    public LedgerResult<CurrencyMutation> mutateCurrency(UUID userId, long delta, EntryKind kind,
                                                         String referenceId, String description) {
        return mutateCurrency(userId, delta, kind, "wallet", referenceId, description);
    }

    public LedgerResult<CurrencyMutation> mutateCurrency(UUID userId, long delta, EntryKind kind, String source,
                                                         String referenceId, String description) {
        if (kind == null || !CURRENCY_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a currency entry kind: " + kind);
        }
        if (!kind.permits(delta)) {
            throw new IllegalArgumentException("Delta " + delta + " has the wrong sign for " + kind.dbValue());
        }

        return executor.execute("wallet." + kind.dbValue(), () -> {
            LedgerAccount account = ledgerService.lockOrCreate(userId, LedgerType.CURRENCY);
            MutationResult mutation = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(delta)
                    .kind(kind)
                    .source(source)
                    .referenceId(referenceId)
                    .description(description)
                    .build());
            return new CurrencyMutation(mutation.getJournalEntryId(), kind.dbValue(), delta, mutation.getNewBalance());
        });
    }

    /**
     * Top-up checked against the daily, monthly and balance limits.
     *
     * @param referenceId idempotency key of the charge request
     */
    public LedgerResult<CurrencyMutation> charge(UUID userId, long amount, String referenceId) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Charge amount must be positive");
        }
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("A charge requires an idempotency key");
        }

        LedgerResult<CurrencyMutation> result = executor.execute("wallet.charge", () -> {
            LedgerAccount account = ledgerService.lockOrCreate(userId, LedgerType.CURRENCY);
            if (ledgerService.isJournaled(account.getId(), EntryKind.TOPUP, referenceId)) {
                throw new LedgerRejection(LedgerError.DUPLICATE_OPERATION, "Charge " + referenceId + " already recorded");
            }
            WalletLimits limits = limitsOf(account);

            if (limits.getDaily().getUsed() + amount > limitPolicy.getDailyLimit()) {
                throw new LedgerRejection(LedgerError.LIMIT_EXCEEDED, "Daily charge limit exceeded");
            }
            if (limits.getMonthly().getUsed() + amount > limitPolicy.getMonthlyLimit()) {
                throw new LedgerRejection(LedgerError.LIMIT_EXCEEDED, "Monthly charge limit exceeded");
            }
            if (account.getBalance() + amount > limitPolicy.getMaxBalance()) {
                throw new LedgerRejection(LedgerError.LIMIT_EXCEEDED, "Maximum balance limit exceeded");
            }

            MutationResult mutation = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(amount)
                    .kind(EntryKind.TOPUP)
                    .source(CHARGE_SOURCE)
                    .referenceId(referenceId)
                    .description("Balance charge")
                    .build());
            return new CurrencyMutation(mutation.getJournalEntryId(), EntryKind.TOPUP.dbValue(), amount,
                    mutation.getNewBalance());
        });

        if (result.isSuccess()) {
            log.info("Wallet charged: userId={}, amount={}, balance={}", userId, amount, result.getValue().getNewBalance());
        }
        return result;
    }

    public WalletBalance getBalance(UUID userId) {
        return balanceCache.get(LedgerType.CURRENCY, userId, WalletBalance.class)
                .orElseGet(() -> {
                    LedgerAccount account = ledgerService.getOrCreateAccount(userId, LedgerType.CURRENCY);
                    WalletBalance balance = WalletBalance.builder()
                            .balance(account.getBalance())
                            .lifetimeInflow(account.getLifetimeInflow())
                            .updatedAt(account.getUpdatedAt())
                            .build();
                    balanceCache.put(LedgerType.CURRENCY, userId, balance);
                    return balance;
                });
    }

    public WalletLimits limits(UUID userId) {
        return limitsOf(ledgerService.getOrCreateAccount(userId, LedgerType.CURRENCY));
    }

    public ResultPage<JournalEntry> history(UUID userId, EntryKind kind, int page, int size) {
        LedgerAccount account = ledgerService.getOrCreateAccount(userId, LedgerType.CURRENCY);
        return ledgerService.history(account.getId(), kind, page, size);
    }

    private WalletLimits limitsOf(LedgerAccount account) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        Instant dayStart = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant monthStart = today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        long usedToday = ledgerService.sumSince(account.getId(), EntryKind.TOPUP, CHARGE_SOURCE, dayStart);
        long usedThisMonth = ledgerService.sumSince(account.getId(), EntryKind.TOPUP, CHARGE_SOURCE, monthStart);

        return new WalletLimits(
                new WalletLimits.Usage(limitPolicy.getDailyLimit(), usedToday),
                new WalletLimits.Usage(limitPolicy.getMonthlyLimit(), usedThisMonth),
                new WalletLimits.Usage(limitPolicy.getMaxBalance(), account.getBalance()));
    }
}
