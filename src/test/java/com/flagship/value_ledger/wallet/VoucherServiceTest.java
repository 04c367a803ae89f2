package com.flagship.value_ledger.wallet;

import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.JournalEntry;
import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.ledger.LedgerService;
import com.flagship.value_ledger.ledger.LedgerType;
import com.flagship.value_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Voucher redemption into the currency wallet against a real database.
 */
class VoucherServiceTest extends PostgresIntegrationTest {

    @Autowired
    private VoucherService voucherService;

    @Autowired
    private VoucherRepository voucherRepository;

    @Autowired
    private WalletService walletService;

    @Autowired
    private LedgerService ledgerService;

    private Voucher voucher(long amount, int usageLimit, Instant validFrom, Instant validUntil) {
        return voucherService.createVoucher(NewVoucher.builder()
                .code("VCH-" + UUID.randomUUID())
                .name("Welcome credit")
                .amount(amount)
                .usageLimit(usageLimit)
                .validFrom(validFrom)
                .validUntil(validUntil)
                .build());
    }

    private Voucher openVoucher(long amount, int usageLimit) {
        Instant now = Instant.now();
        return voucher(amount, usageLimit, now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(1)));
    }

    @Test
    @DisplayName("Redeeming a voucher credits its amount as a top-up")
    void testRedeemVoucher() {
        printTestHeader("Redeem Voucher");

        // Given
        UUID userId = UUID.randomUUID();
        assertTrue(walletService.charge(userId, 10_000, "charge-" + userId).isSuccess());
        Voucher voucher = openVoucher(5_000, 10);
        printInput("Voucher", voucher);

        // When
        LedgerResult<VoucherRedemption> result = voucherService.redeemVoucher(userId, " " + voucher.getCode() + " ");
        printOutput("Result", result);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(5_000, result.getValue().getAmount());
        assertEquals(15_000, result.getValue().getNewBalance());
        assertEquals(15_000, walletService.getBalance(userId).getBalance());
        assertEquals(1, voucherRepository.findByCode(voucher.getCode()).orElseThrow().getUsageCount());

        JournalEntry entry = walletService.history(userId, EntryKind.TOPUP, 1, 10).getItems().get(0);
        assertEquals("voucher", entry.getSource());
        assertEquals(VoucherService.reference(voucher.getId()), entry.getReferenceId());

        // Voucher credits are not charges
        assertEquals(10_000, walletService.limits(userId).getDaily().getUsed());
        printSuccess("Voucher credited once to the wallet");
    }

    @Test
    @DisplayName("A user can use a voucher only once")
    void testSecondUseBySameUser() {
        printTestHeader("Second Use By Same User");

        UUID userId = UUID.randomUUID();
        Voucher voucher = openVoucher(5_000, 10);
        assertTrue(voucherService.redeemVoucher(userId, voucher.getCode()).isSuccess());

        LedgerResult<VoucherRedemption> again = voucherService.redeemVoucher(userId, voucher.getCode());
        printOutput("Second use", again);

        assertEquals(LedgerError.DUPLICATE_OPERATION, again.getError());
        assertEquals(5_000, walletService.getBalance(userId).getBalance());
        assertEquals(1, voucherRepository.findByCode(voucher.getCode()).orElseThrow().getUsageCount());
        printSuccess("Second use rejected");
    }

    @Test
    @DisplayName("Uses beyond the usage limit are rejected")
    void testUsageLimit() {
        printTestHeader("Usage Limit");

        Voucher voucher = openVoucher(1_000, 2);
        assertTrue(voucherService.redeemVoucher(UUID.randomUUID(), voucher.getCode()).isSuccess());
        assertTrue(voucherService.redeemVoucher(UUID.randomUUID(), voucher.getCode()).isSuccess());

        UUID late = UUID.randomUUID();
        LedgerResult<VoucherRedemption> third = voucherService.redeemVoucher(late, voucher.getCode());
        printOutput("Third use", third);

        assertEquals(LedgerError.VOUCHER_EXHAUSTED, third.getError());
        assertTrue(ledgerService.findAccount(late, LedgerType.CURRENCY).isEmpty());
        assertEquals(2, voucherRepository.countUsages(voucher.getId()));
        printSuccess("Usage limit held");
    }

    @Test
    @DisplayName("Concurrent uses never exceed the usage limit")
    void testConcurrentUsesRespectLimit() throws Exception {
        printTestHeader("Concurrent Uses");

        int users = 8;
        Voucher voucher = openVoucher(1_000, 3);
        ExecutorService pool = Executors.newFixedThreadPool(users);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LedgerResult<VoucherRedemption>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < users; i++) {
                UUID userId = UUID.randomUUID();
                futures.add(pool.submit(() -> {
                    start.await();
                    return voucherService.redeemVoucher(userId, voucher.getCode());
                }));
            }
            start.countDown();

            int succeeded = 0;
            int exhausted = 0;
            for (Future<LedgerResult<VoucherRedemption>> future : futures) {
                LedgerResult<VoucherRedemption> result = future.get(30, TimeUnit.SECONDS);
                if (result.isSuccess()) {
                    succeeded++;
                } else if (result.getError() == LedgerError.VOUCHER_EXHAUSTED) {
                    exhausted++;
                }
            }
            printOutput("Succeeded", succeeded);

            assertEquals(3, succeeded);
            assertEquals(users - 3, exhausted);
            assertEquals(3, voucherRepository.findByCode(voucher.getCode()).orElseThrow().getUsageCount());
            assertEquals(3, voucherRepository.countUsages(voucher.getId()));
        } finally {
            pool.shutdownNow();
        }
        printSuccess("Usage count bounded by the limit");
    }

    @Test
    @DisplayName("Unknown, inactive and out-of-window vouchers credit nothing")
    void testUnusableVouchers() {
        printTestHeader("Unusable Vouchers");

        UUID userId = UUID.randomUUID();
        Instant now = Instant.now();

        assertEquals(LedgerError.NOT_FOUND, voucherService.redeemVoucher(userId, "NO-SUCH-CODE").getError());

        Voucher upcoming = voucher(1_000, 5, now.plus(Duration.ofDays(1)), now.plus(Duration.ofDays(2)));
        assertEquals(LedgerError.VOUCHER_UNAVAILABLE, voucherService.redeemVoucher(userId, upcoming.getCode()).getError());

        Voucher expired = voucher(1_000, 5, now.minus(Duration.ofDays(2)), now.minus(Duration.ofDays(1)));
        assertEquals(LedgerError.VOUCHER_UNAVAILABLE, voucherService.redeemVoucher(userId, expired.getCode()).getError());

        Voucher withdrawn = openVoucher(1_000, 5);
        LedgerResult<Voucher> deactivated = voucherService.deactivate(withdrawn.getCode());
        assertEquals(VoucherStatus.INACTIVE, deactivated.getValue().getStatus());
        assertEquals(LedgerError.VOUCHER_UNAVAILABLE, voucherService.redeemVoucher(userId, withdrawn.getCode()).getError());
        assertEquals(LedgerError.NOT_FOUND, voucherService.deactivate("NO-SUCH-CODE").getError());

        assertTrue(ledgerService.findAccount(userId, LedgerType.CURRENCY).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> voucherService.redeemVoucher(userId, " "));
        printSuccess("Nothing credited");
    }
}
