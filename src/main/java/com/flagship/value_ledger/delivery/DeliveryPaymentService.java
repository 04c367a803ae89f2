package com.flagship.value_ledger.delivery;

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
import com.flagship.value_ledger.wallet.CurrencyMutation;
import com.flagship.value_ledger.wallet.WalletService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Pays for and refunds delivery orders from the currency wallet.
 * Both are keyed by order id, so each happens at most once per order.
 *
 * A refund credits back exactly what the order's payment entry debited; the
 * amount is read from the journal under the account lock, never taken from
 * the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryPaymentService {

    static final String SOURCE = "delivery";

    private final WalletService walletService;
    private final LedgerService ledgerService;
    private final LedgerTransactionExecutor executor;

    public LedgerResult<CurrencyMutation> payOrder(UUID userId, String orderId, long total) {
        requireOrderId(orderId);
        if (total <= 0) {
            throw new IllegalArgumentException("Order total must be positive");
        }
        LedgerResult<CurrencyMutation> result = walletService.mutateCurrency(
                userId, -total, EntryKind.PAYMENT, SOURCE, reference(orderId), "Delivery order payment: " + orderId);
        log.info("Delivery order payment: userId={}, orderId={}, total={}, outcome={}",
                userId, orderId, total, outcome(result));
        return result;
    }

    /**
     * Refunds the full amount paid for an order.
     * An order this user never paid yields NOT_FOUND; a second refund yields DUPLICATE_OPERATION.
     */
    public LedgerResult<CurrencyMutation> refundOrder(UUID userId, String orderId) {
        return refundOrder(userId, orderId, null);
    }

    /**
     * Refunds an order, checking the amount the client expects back.
     *
     * @param expectedTotal amount the client believes was paid, null to skip the check;
     *                      any other amount than the paid one yields REFUND_AMOUNT_MISMATCH
     */
    public LedgerResult<CurrencyMutation> refundOrder(UUID userId, String orderId, Long expectedTotal) {
        requireOrderId(orderId);
        String reference = reference(orderId);

        LedgerResult<CurrencyMutation> result = executor.execute("delivery.refund", () -> {
            LedgerAccount account = ledgerService.lockOrCreate(userId, LedgerType.CURRENCY);
            JournalEntry payment = ledgerService.findJournaled(account.getId(), EntryKind.PAYMENT, reference)
                    .orElseThrow(() -> new LedgerRejection(LedgerError.NOT_FOUND,
                            "No payment recorded for order " + orderId));

            long paid = -payment.getDelta();
            if (expectedTotal != null && expectedTotal != paid) {
                throw new LedgerRejection(LedgerError.REFUND_AMOUNT_MISMATCH, String.format(
                        "Order %s was paid %d, refund of %d refused", orderId, paid, expectedTotal));
            }

            MutationResult refund = ledgerService.applyMutation(MutationRequest.builder()
                    .accountId(account.getId())
                    .delta(paid)
                    .kind(EntryKind.REFUND)
                    .source(SOURCE)
                    .referenceId(reference)
                    .description("Delivery order refund: " + orderId)
                    .build());
            return new CurrencyMutation(refund.getJournalEntryId(), EntryKind.REFUND.dbValue(), paid,
                    refund.getNewBalance());
        });

        log.info("Delivery order refund: userId={}, orderId={}, amount={}, outcome={}",
                userId, orderId, result.isSuccess() ? result.getValue().getDelta() : expectedTotal, outcome(result));
        return result;
    }

    static String reference(String orderId) {
        return "delivery-order:" + orderId;
    }

    private static String outcome(LedgerResult<?> result) {
        return result.isSuccess() ? "success" : result.getError().name();
    }

    private static void requireOrderId(String orderId) {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("Order id is required");
        }
    }
}
