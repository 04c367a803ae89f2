package com.flagship.value_ledger.wallet;

import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.wallet.dto.ChargeRequest;
import com.flagship.value_ledger.wallet.dto.CreateVoucherRequest;
import com.flagship.value_ledger.wallet.dto.CurrencyMutationRequest;
import com.flagship.value_ledger.wallet.dto.RedeemVoucherRequest;
import com.flagship.value_ledger.web.JournalEntryResponse;
import com.flagship.value_ledger.web.PageResponse;
import com.flagship.value_ledger.web.RequestHeaders;
import com.flagship.value_ledger.web.ResultResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    static final int MAX_PAGE_SIZE = 100;

    private final WalletService walletService;
    private final VoucherService voucherService;

    @GetMapping("/balance")
    public WalletBalance balance(@RequestHeader(RequestHeaders.USER_ID) UUID userId) {
        return walletService.getBalance(userId);
    }

    @GetMapping("/limits")
    public WalletLimits limits(@RequestHeader(RequestHeaders.USER_ID) UUID userId) {
        return walletService.limits(userId);
    }

    @GetMapping("/history")
    public PageResponse<JournalEntryResponse> history(
            @RequestHeader(RequestHeaders.USER_ID) UUID userId,
            @RequestParam(name = "kind", required = false) String kind,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        EntryKind filter = kind != null ? EntryKind.fromDbValue(kind) : null;
        return PageResponse.from(
                walletService.history(userId, filter, page, Math.min(size, MAX_PAGE_SIZE)),
                JournalEntryResponse::from);
    }

    /**
     * Idempotent top-up: a repeated Idempotency-Key is answered with 409 and charges nothing.
     */
    @PostMapping("/charge")
    public ResponseEntity<?> charge(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                    @RequestHeader(RequestHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
                                    @Valid @RequestBody ChargeRequest request) {
        log.info("Charge request: userId={}, idempotencyKey={}, amount={}", userId, idempotencyKey, request.getAmount());
        LedgerResult<CurrencyMutation> result = walletService.charge(userId, request.getAmount(), idempotencyKey);
        return ResultResponses.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/mutations")
    public ResponseEntity<?> mutate(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                    @Valid @RequestBody CurrencyMutationRequest request) {
        LedgerResult<CurrencyMutation> result = walletService.mutateCurrency(
                userId,
                request.getDelta(),
                EntryKind.fromDbValue(request.getKind()),
                request.getReferenceId(),
                request.getDescription());
        return ResultResponses.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/redeem")
    public ResponseEntity<?> redeemVoucher(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                           @Valid @RequestBody RedeemVoucherRequest request) {
        return ResultResponses.toResponse(voucherService.redeemVoucher(userId, request.getCode()), HttpStatus.OK);
    }

    @PostMapping("/vouchers")
    public ResponseEntity<Voucher> createVoucher(@Valid @RequestBody CreateVoucherRequest request) {
        Voucher voucher = voucherService.createVoucher(NewVoucher.builder()
                .code(request.getCode())
                .name(request.getName())
                .amount(request.getAmount())
                .usageLimit(request.getUsageLimit())
                .validFrom(request.getValidFrom())
                .validUntil(request.getValidUntil())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(voucher);
    }

    @PostMapping("/vouchers/{code}/deactivate")
    public ResponseEntity<?> deactivateVoucher(@PathVariable("code") String code) {
        return ResultResponses.toResponse(voucherService.deactivate(code), HttpStatus.OK);
    }
}
