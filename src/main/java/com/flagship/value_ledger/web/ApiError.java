package com.flagship.value_ledger.web;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint. code is a {@code LedgerError} name for
 * domain rejections and a generic code otherwise.
 */
@Value
@Builder
public class ApiError {
    String code;
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
