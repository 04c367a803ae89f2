package com.flagship.value_ledger.rewards;

import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.rewards.dto.CreateRewardRequest;
import com.flagship.value_ledger.web.PageResponse;
import com.flagship.value_ledger.web.RequestHeaders;
import com.flagship.value_ledger.web.ResultResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
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

import static com.flagship.value_ledger.observability.CorrelationContext.REWARD_ID_MDC_KEY;

@RestController
@RequestMapping("/api/loyalty/rewards")
@RequiredArgsConstructor
@Slf4j
public class RewardController {

    static final int MAX_PAGE_SIZE = 50;

    private final RewardCatalogService catalogService;

    @GetMapping
    public PageResponse<RewardView> list(
            @RequestHeader(RequestHeaders.USER_ID) UUID userId,
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "merchantId", required = false) UUID merchantId,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "size", defaultValue = "20") int size) {
        RewardType filter = type != null ? RewardType.fromDbValue(type) : null;
        return PageResponse.from(
                catalogService.listAvailable(userId, filter, merchantId, page, Math.min(size, MAX_PAGE_SIZE)),
                view -> view);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                 @PathVariable("id") UUID rewardId) {
        return ResultResponses.toResponse(catalogService.getReward(userId, rewardId), HttpStatus.OK);
    }

    @PostMapping
    public ResponseEntity<Reward> create(
            @RequestHeader(name = RequestHeaders.MERCHANT_ID, required = false) UUID merchantId,
            @Valid @RequestBody CreateRewardRequest request) {
        Reward reward = catalogService.createReward(NewReward.builder()
                .merchantId(merchantId)
                .name(request.getName())
                .description(request.getDescription())
                .rewardType(RewardType.fromDbValue(request.getRewardType()))
                .value(request.getValue())
                .pointsRequired(request.getPointsRequired())
                .quantity(request.getQuantity())
                .validUntil(request.getValidUntil())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(reward);
    }

    @PostMapping("/{id}/redeem")
    public ResponseEntity<?> redeem(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                    @PathVariable("id") UUID rewardId) {
        MDC.put(REWARD_ID_MDC_KEY, rewardId.toString());
        try {
            LedgerResult<RedemptionResult> result = catalogService.redeemReward(userId, rewardId);
            log.info("Reward redemption request: userId={}, outcome={}",
                    userId, result.isSuccess() ? "success" : result.getError().name());
            return ResultResponses.toResponse(result, HttpStatus.OK);
        } finally {
            MDC.remove(REWARD_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<?> deactivate(@PathVariable("id") UUID rewardId) {
        return ResultResponses.toResponse(catalogService.deactivate(rewardId), HttpStatus.OK);
    }
}
