package com.flagship.value_ledger.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A purchase the payment platform has settled. Each one earns loyalty points
 * for the paying user, keyed by the payment id.
 */
@Value
@Builder
@Jacksonized
public class PurchaseSettledEvent {
    UUID eventId;
    String paymentId;
    UUID userId;
    long amount;
    String source;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PurchaseSettled";
}
