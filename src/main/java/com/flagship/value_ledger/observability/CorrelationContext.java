package com.flagship.value_ledger.observability;

import java.util.UUID;

/**
 * Header and MDC key names for request correlation.
 *
 * The correlation id is carried in MDC so that every log line written while a
 * request or a consumed message is processed can be tied back to it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String REWARD_ID_MDC_KEY = "rewardId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Short form, readable in logs.
     */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static String orNew(String candidate) {
        return candidate == null || candidate.isBlank() ? newCorrelationId() : candidate;
    }
}
