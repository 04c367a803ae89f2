package com.flagship.value_ledger.web;

/**
 * Identity headers set by the platform's gateway after authentication.
 * The ledger trusts them as given.
 */
public final class RequestHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String MERCHANT_ID = "X-Merchant-Id";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private RequestHeaders() {
        // Utility class
    }
}
