package com.flagship.value_ledger.delivery;

import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.ledger.LedgerService;
import com.flagship.value_ledger.ledger.LedgerType;
import com.flagship.value_ledger.ledger.ReconciliationReport;
import com.flagship.value_ledger.support.PostgresIntegrationTest;
import com.flagship.value_ledger.wallet.CurrencyMutation;
import com.flagship.value_ledger.wallet.WalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryPaymentServiceTest extends PostgresIntegrationTest {

    @Autowired
    private DeliveryPaymentService deliveryService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private LedgerService ledgerService;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        assertTrue(walletService.charge(userId, 50_000, "charge-" + userId).isSuccess());
    }

    @Test
    @DisplayName("An order is paid once and refunded once")
    void testPayAndRefund() {
        printTestHeader("Pay And Refund");

        LedgerResult<CurrencyMutation> payment = deliveryService.payOrder(userId, "order-42", 18_000);
        printOutput("Payment", payment);
        assertTrue(payment.isSuccess());
        assertEquals(32_000, payment.getValue().getNewBalance());

        assertTrue(deliveryService.payOrder(userId, "order-42", 18_000).isDuplicate());

        LedgerResult<CurrencyMutation> refund = deliveryService.refundOrder(userId, "order-42");
        printOutput("Refund", refund);
        assertTrue(refund.isSuccess());
        assertEquals(18_000, refund.getValue().getDelta());
        assertEquals(50_000, refund.getValue().getNewBalance());

        assertTrue(deliveryService.refundOrder(userId, "order-42").isDuplicate());
        assertEquals(50_000, walletService.getBalance(userId).getBalance());
        printSuccess("Order settled exactly once each way");
    }

    @Test
    @DisplayName("A refund never credits more than the order's payment")
    void testRefundLargerThanPayment() {
        printTestHeader("Refund Larger Than Payment");

        // Given: an order paid 100
        assertTrue(deliveryService.payOrder(userId, "order-small", 100).isSuccess());
        assertEquals(49_900, walletService.getBalance(userId).getBalance());

        // When: a refund of 1,000,000 is requested
        LedgerResult<CurrencyMutation> inflated = deliveryService.refundOrder(userId, "order-small", 1_000_000L);
        printOutput("Inflated refund", inflated);

        // Then: it is refused and nothing is credited
        assertEquals(LedgerError.REFUND_AMOUNT_MISMATCH, inflated.getError());
        assertEquals(49_900, walletService.getBalance(userId).getBalance());

        // And: the matching amount is refunded exactly once
        LedgerResult<CurrencyMutation> refund = deliveryService.refundOrder(userId, "order-small", 100L);
        assertTrue(refund.isSuccess());
        assertEquals(100, refund.getValue().getDelta());
        assertEquals(50_000, refund.getValue().getNewBalance());
        assertTrue(deliveryService.refundOrder(userId, "order-small", 100L).isDuplicate());

        UUID accountId = ledgerService.findAccount(userId, LedgerType.CURRENCY).orElseThrow().getId();
        ReconciliationReport report = ledgerService.reconcile(accountId).getValue();
        assertTrue(report.isConsistent());
        assertEquals(50_000, report.getBalance());
        printSuccess("Refund bounded by the journaled payment");
    }

    @Test
    @DisplayName("A user cannot refund another user's order")
    void testRefundOtherUsersOrder() {
        printTestHeader("Refund Other User's Order");

        // Given: the order is paid by userId
        assertTrue(deliveryService.payOrder(userId, "order-shared", 5_000).isSuccess());
        UUID stranger = UUID.randomUUID();

        // When: someone else asks for the refund
        LedgerResult<CurrencyMutation> refund = deliveryService.refundOrder(stranger, "order-shared");
        printOutput("Stranger refund", refund);

        // Then: no payment is found for them and no wallet is credited
        assertEquals(LedgerError.NOT_FOUND, refund.getError());
        assertTrue(ledgerService.findAccount(stranger, LedgerType.CURRENCY).isEmpty());
        assertEquals(45_000, walletService.getBalance(userId).getBalance());

        // And: the payer can still get the refund
        assertTrue(deliveryService.refundOrder(userId, "order-shared").isSuccess());
        assertEquals(50_000, walletService.getBalance(userId).getBalance());
        printSuccess("Refunds are scoped to the paying user");
    }

    @Test
    @DisplayName("An order larger than the balance is not paid")
    void testInsufficientBalance() {
        LedgerResult<CurrencyMutation> payment = deliveryService.payOrder(userId, "order-big", 60_000);

        assertEquals(LedgerError.INSUFFICIENT_BALANCE, payment.getError());
        assertEquals(50_000, walletService.getBalance(userId).getBalance());
    }

    @Test
    @DisplayName("Refunding an unpaid order yields NOT_FOUND")
    void testRefundUnpaidOrder() {
        assertEquals(LedgerError.NOT_FOUND, deliveryService.refundOrder(userId, "order-unknown").getError());
        assertEquals(LedgerError.NOT_FOUND,
                deliveryService.refundOrder(UUID.randomUUID(), "order-unknown").getError());
        assertEquals(50_000, walletService.getBalance(userId).getBalance());
    }

    @Test
    @DisplayName("Order ids and totals are validated")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> deliveryService.payOrder(userId, " ", 100));
        assertThrows(IllegalArgumentException.class, () -> deliveryService.payOrder(userId, "order-1", 0));
        assertThrows(IllegalArgumentException.class, () -> deliveryService.refundOrder(userId, null));
        assertEquals("delivery-order:order-1", DeliveryPaymentService.reference("order-1"));
    }
}
