package com.flagship.value_ledger.wallet;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Wallet vouchers: codes that credit a fixed amount to the currency wallet.
 *
 * A use locks the voucher row before the wallet account, so the usage count
 * cannot pass the voucher's limit under concurrent uses. The credit is a TOPUP
 * keyed {@code voucher:<id>}, which the journal accepts once per user.
 * Voucher credits are not charges and do not count against the charge limits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherService {

    static final String SOURCE = "voucher";
    static final String AUDIT_TARGET_TYPE = "voucher";

    private final VoucherRepository voucherRepository;
    private final LedgerService ledgerService;
    private final LedgerTransactionExecutor executor;
    private final AuditPublisher auditPublisher;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if the voucher definition is malformed
     */
    @Transactional
    public Voucher createVoucher(NewVoucher definition) {
        definition.validate();
        Voucher voucher = new Voucher(
                UUID.randomUUID(),
                definition.getCode().trim(),
                definition.getName(),
                definition.getAmount(),
                definition.getUsageLimit(),
                0,
                VoucherStatus.ACTIVE,
                definition.getValidFrom(),
                definition.getValidUntil(),
                Instant.now(clock));
        voucherRepository.insert(voucher);
        log.info("Voucher created: voucherId={}, code={}, amount={}, usageLimit={}",
                voucher.getId(), voucher.getCode(), voucher.getAmount(), voucher.getUsageLimit());
        return voucher;
    }

    public LedgerResult<Voucher> deactivate(String code) {
        return executor.execute("voucher.deactivate", () -> {
            Voucher voucher = voucherRepository.lockByCode(code)
                    .orElseThrow(() -> notFound(code));
            voucherRepository.updateStatus(voucher.getId(), VoucherStatus.INACTIVE);
            return voucherRepository.findByCode(code).orElseThrow();
        });
    }

    /**
     * Credits the voucher's amount to the user's wallet.
     *
     * Unknown codes yield NOT_FOUND, a second use by the same user DUPLICATE_OPERATION.
     */
    public LedgerResult<VoucherRedemption> redeemVoucher(UUID userId, String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Voucher code is required");
        }
        String normalized = code.trim();

        LedgerResult<VoucherRedemption> result = executor.execute("voucher.redeem", () -> {
            Instant now = Instant.now(clock);
            Voucher voucher = voucherRepository.lockByCode(normalized)
                    .orElseThrow(() -> notFound(normalized));
            voucher.requireUsableAt(now);
            if (voucherRepository.isUsedBy(voucher.getId(), userId)) {
                throw new LedgerRejection(LedgerError.DUPLICATE_OPERATION,
                        "Voucher " + normalized + " already used by this user");
            }

            LedgerAccount account = ledgerService.lockOrCreate(userId, LedgerType.CURRENCY);
            MutationResult credit = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(voucher.getAmount())
                    .kind(EntryKind.TOPUP)
                    .source(SOURCE)
                    .referenceId(reference(voucher.getId()))
                    .description("Voucher redeemed: " + voucher.getName())
                    .build());

            Voucher used = voucher.recordUse();
            voucherRepository.updateUsageCount(used);
            voucherRepository.insertUsage(voucher.getId(), userId, credit.getJournalEntryId(), now);

            auditPublisher.publishAfterCommit(AuditEvent.builder()
                    .eventId(UUID.randomUUID())
                    .action("VOUCHER_REDEEMED")
                    .actorId(userId.toString())
                    .actorType("user")
                    .targetType(AUDIT_TARGET_TYPE)
                    .targetId(voucher.getId())
                    .description("Voucher redeemed: " + voucher.getName())
                    .metadataEntry("code", voucher.getCode())
                    .metadataEntry("amount", voucher.getAmount())
                    .metadataEntry("usageCount", used.getUsageCount())
                    .occurredAt(now)
                    .build());

            return new VoucherRedemption(voucher.getId(), voucher.getName(), credit.getJournalEntryId(),
                    voucher.getAmount(), credit.getNewBalance());
        });

        log.info("Voucher redemption: userId={}, code={}, outcome={}",
                userId, normalized, result.isSuccess() ? "success" : result.getError().name());
        return result;
    }

    static String reference(UUID voucherId) {
        return "voucher:" + voucherId;
    }

    private static LedgerRejection notFound(String code) {
        return new LedgerRejection(LedgerError.NOT_FOUND, "Invalid voucher code: " + code);
    }
}
