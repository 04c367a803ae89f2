package com.flagship.value_ledger.ledger;

import com.flagship.value_ledger.audit.AuditEvent;
import com.flagship.value_ledger.audit.AuditPublisher;
import com.flagship.value_ledger.cache.BalanceCache;
import com.flagship.value_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * The only path that changes a balance.
 *
 * A mutation locks the account row, appends one journal entry and updates the
 * stored balance in the same transaction, so for every account the balance
 * equals the sum of its journal. Idempotency rests on the journal's unique key
 * (account, kind, referenceId); the pre-check only exists to report the
 * duplicate before the insert is attempted.
 *
 * {@link #mutate} runs a single mutation in its own transaction. Composite
 * operations (cross-ledger redemption, reward redemption) open one transaction
 * through {@link LedgerTransactionExecutor} and call {@link #applyMutation} for
 * each step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String AUDIT_TARGET_TYPE = "ledger_account";

    private final LedgerAccountRepository accountRepository;
    private final JournalRepository journalRepository;
    private final LedgerTransactionExecutor executor;
    private final AuditPublisher auditPublisher;
    private final BalanceCache balanceCache;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if the request is malformed (wrong delta sign, blank reference)
     * @throws StorageFaultException    on a storage failure that retrying did not resolve
     */
    public LedgerResult<MutationResult> mutate(MutationRequest request) {
        request.validate();
        return executor.execute("mutate", () -> applyMutation(request));
    }

    /**
     * Mutation step inside a transaction opened by the caller.
     *
     * @throws LedgerRejection when a precondition fails; the caller's transaction must roll back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MutationResult applyMutation(MutationRequest request) {
        request.validate();

        LedgerAccount account = accountRepository.lockById(request.getAccountId())
                .filter(found -> !found.isArchived())
                .orElseThrow(() -> new LedgerRejection(LedgerError.ACCOUNT_NOT_FOUND,
                        "Account not found: " + request.getAccountId()));

        if (request.getReferenceId() != null
                && journalRepository.existsByReference(account.getId(), request.getKind(), request.getReferenceId())) {
            throw duplicate(request);
        }

        if (account.getBalance() + request.getDelta() < 0) {
            throw new LedgerRejection(account.getLedgerType().insufficientFundsError(),
                    String.format("Balance %d cannot cover %d", account.getBalance(), -request.getDelta()));
        }

        JournalEntry entry = new JournalEntry(
                UUID.randomUUID(),
                account.getId(),
                request.getDelta(),
                request.getKind(),
                request.getSource(),
                request.getReferenceId(),
                request.getDescription(),
                request.getExpiresAt(),
                Instant.now(clock),
                null);
        if (!journalRepository.insert(entry)) {
            // a concurrent insert won the unique key between the pre-check and here
            throw duplicate(request);
        }

        LedgerAccount updated = accountRepository.applyDelta(
                account.getId(), request.getDelta(), request.getTierPointsDelta());

        metrics.recordMutation(account.getLedgerType(), request.getKind());
        balanceCache.evictAfterCommit(account.getLedgerType(), account.getOwnerId());
        auditPublisher.publishAfterCommit(auditEvent(account, updated, entry));

        log.debug("Ledger mutation applied: accountId={}, kind={}, delta={}, balance={} -> {}",
                account.getId(), request.getKind().dbValue(), request.getDelta(),
                account.getBalance(), updated.getBalance());

        return new MutationResult(
                account.getId(),
                entry.getId(),
                request.getDelta(),
                updated.getBalance(),
                updated.getLifetimeInflow(),
                updated.getTierPoints());
    }

    /**
     * Gets or creates the owner's account of the given type and locks it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerAccount lockOrCreate(UUID ownerId, LedgerType ledgerType) {
        accountRepository.insertIfAbsent(ownerId, ledgerType, initialTier(ledgerType));
        return accountRepository.lockByOwner(ownerId, ledgerType)
                .orElseThrow(() -> new IllegalStateException(
                        "Account vanished after insert: owner=" + ownerId + ", type=" + ledgerType));
    }

    /**
     * Locks an existing account.
     *
     * @throws LedgerRejection ACCOUNT_NOT_FOUND if the owner has no account of this type
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerAccount lockExisting(UUID ownerId, LedgerType ledgerType) {
        return accountRepository.lockByOwner(ownerId, ledgerType)
                .orElseThrow(() -> new LedgerRejection(LedgerError.ACCOUNT_NOT_FOUND,
                        "No " + ledgerType.name().toLowerCase() + " account for owner " + ownerId));
    }

    /**
     * Stores a new tier label on a locked points account.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void updateTier(LedgerAccount account, String tier) {
        accountRepository.updateTier(account.getId(), tier);
        balanceCache.evictAfterCommit(account.getLedgerType(), account.getOwnerId());
    }

    @Transactional
    public LedgerAccount getOrCreateAccount(UUID ownerId, LedgerType ledgerType) {
        accountRepository.insertIfAbsent(ownerId, ledgerType, initialTier(ledgerType));
        return accountRepository.findByOwner(ownerId, ledgerType)
                .orElseThrow(() -> new IllegalStateException(
                        "Account vanished after insert: owner=" + ownerId + ", type=" + ledgerType));
    }

    @Transactional(readOnly = true)
    public Optional<LedgerAccount> findAccount(UUID ownerId, LedgerType ledgerType) {
        return accountRepository.findByOwner(ownerId, ledgerType);
    }

    /**
     * Journal of an account, newest first.
     *
     * @param kind optional filter, null for all kinds
     * @param page 1-based
     */
    @Transactional(readOnly = true)
    public ResultPage<JournalEntry> history(UUID accountId, EntryKind kind, int page, int size) {
        if (page < 1 || size < 1) {
            throw new IllegalArgumentException("page and size must be positive");
        }
        long total = journalRepository.countByAccount(accountId, kind);
        long offset = (long) (page - 1) * size;
        return new ResultPage<>(journalRepository.findByAccount(accountId, kind, size, offset), page, size, total);
    }

    @Transactional(readOnly = true)
    public boolean isJournaled(UUID accountId, EntryKind kind, String referenceId) {
        return journalRepository.existsByReference(accountId, kind, referenceId);
    }

    /**
     * The entry journaled under (account, kind, referenceId), if any.
     */
    @Transactional(readOnly = true)
    public Optional<JournalEntry> findJournaled(UUID accountId, EntryKind kind, String referenceId) {
        return journalRepository.findByReference(accountId, kind, referenceId);
    }

    /**
     * Sum of the deltas of one kind and source journaled on an account since the given instant.
     */
    @Transactional(readOnly = true)
    public long sumSince(UUID accountId, EntryKind kind, String source, Instant since) {
        return journalRepository.sumDeltasSince(accountId, kind, source, since);
    }

    /**
     * Compares the stored balance with the journal sum under the account lock.
     */
    public LedgerResult<ReconciliationReport> reconcile(UUID accountId) {
        return executor.execute("reconcile", () -> {
            LedgerAccount account = accountRepository.lockById(accountId)
                    .orElseThrow(() -> new LedgerRejection(LedgerError.ACCOUNT_NOT_FOUND,
                            "Account not found: " + accountId));
            ReconciliationReport report = new ReconciliationReport(
                    accountId,
                    account.getBalance(),
                    journalRepository.sumDeltas(accountId),
                    journalRepository.countByAccount(accountId, null));
            if (!report.isConsistent()) {
                log.error("Ledger inconsistency: accountId={}, balance={}, journalSum={}",
                        accountId, report.getBalance(), report.getJournalSum());
            }
            return report;
        });
    }

    private static String initialTier(LedgerType ledgerType) {
        return ledgerType == LedgerType.POINTS ? "bronze" : null;
    }

    private static LedgerRejection duplicate(MutationRequest request) {
        return new LedgerRejection(LedgerError.DUPLICATE_OPERATION, String.format(
                "%s with reference %s already recorded", request.getKind().dbValue(), request.getReferenceId()));
    }

    private AuditEvent auditEvent(LedgerAccount before, LedgerAccount after, JournalEntry entry) {
        return AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .action("LEDGER_" + entry.getKind().name())
                .actorId(before.getOwnerId().toString())
                .actorType("user")
                .targetType(AUDIT_TARGET_TYPE)
                .targetId(before.getId())
                .description(entry.getDescription())
                .metadataEntry("ledgerType", before.getLedgerType().name())
                .metadataEntry("journalEntryId", entry.getId().toString())
                .metadataEntry("delta", entry.getDelta())
                .metadataEntry("balanceBefore", before.getBalance())
                .metadataEntry("balanceAfter", after.getBalance())
                .metadataEntry("source", entry.getSource() != null ? entry.getSource() : "")
                .metadataEntry("referenceId", entry.getReferenceId() != null ? entry.getReferenceId() : "")
                .occurredAt(entry.getCreatedAt())
                .build();
    }
}
