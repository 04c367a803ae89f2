package com.flagship.value_ledger.loyalty;

import com.flagship.value_ledger.ledger.EntryKind;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.loyalty.dto.EarnPointsRequest;
import com.flagship.value_ledger.loyalty.dto.MerchantRedeemRequest;
import com.flagship.value_ledger.loyalty.dto.RedeemPointsRequest;
import com.flagship.value_ledger.loyalty.dto.TierTableResponse;
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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Loyalty points endpoints. The caller is identified by {@code X-User-Id};
 * merchant endpoints additionally take {@code X-Merchant-Id}.
 */
@RestController
@RequestMapping("/api/loyalty")
@RequiredArgsConstructor
@Slf4j
public class LoyaltyController {

    static final int MAX_PAGE_SIZE = 100;

    private final LoyaltyAccountService loyaltyService;
    private final LoyaltyReportService reportService;
    private final TierEngine tierEngine;

    @GetMapping("/balance")
    public LoyaltyBalance balance(@RequestHeader(RequestHeaders.USER_ID) UUID userId) {
        return loyaltyService.getBalance(userId);
    }

    @GetMapping("/history")
    public PageResponse<JournalEntryResponse> history(
            @RequestHeader(RequestHeaders.USER_ID) UUID userId,
            @RequestParam(name = "kind", required = false) String kind,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        EntryKind filter = kind != null ? EntryKind.fromDbValue(kind) : null;
        return PageResponse.from(
                loyaltyService.history(userId, filter, page, Math.min(size, MAX_PAGE_SIZE)),
                JournalEntryResponse::from);
    }

    @GetMapping("/tiers")
    public TierTableResponse tiers() {
        return TierTableResponse.from(tierEngine.tiers());
    }

    @PostMapping("/earn")
    public ResponseEntity<?> earn(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                  @Valid @RequestBody EarnPointsRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Earn request: userId={}, transactionId={}, amount={}",
                userId, request.getTransactionId(), request.getAmount());

        LedgerResult<EarnResult> result = loyaltyService.earn(
                userId, request.getAmount(), request.getTransactionId(), request.getSource());

        log.info("Earn request finished: userId={}, outcome={}, duration={}ms",
                userId, outcome(result), System.currentTimeMillis() - startTime);
        return ResultResponses.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/redeem")
    public ResponseEntity<?> redeem(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                    @Valid @RequestBody RedeemPointsRequest request) {
        LedgerResult<RedeemResult> result = loyaltyService.redeem(userId, request.getPoints());
        log.info("Points redemption: userId={}, points={}, outcome={}", userId, request.getPoints(), outcome(result));
        return ResultResponses.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/merchant/redeem")
    public ResponseEntity<?> merchantRedeem(@RequestHeader(RequestHeaders.MERCHANT_ID) UUID merchantId,
                                            @Valid @RequestBody MerchantRedeemRequest request) {
        LedgerResult<MerchantRedemptionResult> result = loyaltyService.merchantRedeem(
                merchantId, request.getCustomerId(), request.getPoints(), request.getDescription());
        log.info("Merchant redemption: merchantId={}, customerId={}, points={}, outcome={}",
                merchantId, request.getCustomerId(), request.getPoints(), outcome(result));
        return ResultResponses.toResponse(result, HttpStatus.OK);
    }

    @GetMapping("/admin/stats")
    public LoyaltyStatistics statistics() {
        return reportService.statistics();
    }

    private static String outcome(LedgerResult<?> result) {
        return result.isSuccess() ? "success" : result.getError().name();
    }
}
