package com.flagship.value_ledger.delivery;

import com.flagship.value_ledger.web.RequestHeaders;
import com.flagship.value_ledger.web.ResultResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/delivery/orders")
@RequiredArgsConstructor
public class DeliveryController {

    private final DeliveryPaymentService deliveryPaymentService;

    @PostMapping("/{orderId}/payment")
    public ResponseEntity<?> pay(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                 @PathVariable("orderId") String orderId,
                                 @Valid @RequestBody OrderAmountRequest request) {
        return ResultResponses.toResponse(
                deliveryPaymentService.payOrder(userId, orderId, request.getTotal()), HttpStatus.OK);
    }

    /**
     * Refunds what was paid for the order. A body total, when sent, must match it.
     */
    @PostMapping("/{orderId}/refund")
    public ResponseEntity<?> refund(@RequestHeader(RequestHeaders.USER_ID) UUID userId,
                                    @PathVariable("orderId") String orderId,
                                    @Valid @RequestBody(required = false) OrderAmountRequest request) {
        Long expectedTotal = request != null ? request.getTotal() : null;
        return ResultResponses.toResponse(
                deliveryPaymentService.refundOrder(userId, orderId, expectedTotal), HttpStatus.OK);
    }
}
