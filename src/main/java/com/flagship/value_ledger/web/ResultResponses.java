package com.flagship.value_ledger.web;

import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.function.Function;

/**
 * Turns {@link LedgerResult}s into HTTP responses.
 */
public final class ResultResponses {

    private ResultResponses() {
        // Utility class
    }

    public static <T> ResponseEntity<?> toResponse(LedgerResult<T> result, HttpStatus successStatus) {
        return toResponse(result, successStatus, Function.identity());
    }

    public static <T, R> ResponseEntity<?> toResponse(LedgerResult<T> result, HttpStatus successStatus,
                                                      Function<? super T, R> body) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(body.apply(result.getValue()));
        }
        ApiError error = ApiError.builder()
                .code(result.getError().name())
                .error(statusFor(result.getError()).getReasonPhrase())
                .message(result.getMessage())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(statusFor(result.getError())).body(error);
    }

    public static HttpStatus statusFor(LedgerError error) {
        return switch (error) {
            case INSUFFICIENT_BALANCE, INSUFFICIENT_POINTS, LIMIT_EXCEEDED, REFUND_AMOUNT_MISMATCH ->
                    HttpStatus.UNPROCESSABLE_ENTITY;
            case DUPLICATE_OPERATION, REWARD_UNAVAILABLE, REWARD_EXPIRED, REWARD_EXHAUSTED,
                 VOUCHER_UNAVAILABLE, VOUCHER_EXHAUSTED -> HttpStatus.CONFLICT;
            case NOT_FOUND, ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}
