package com.flagship.value_ledger.consumer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.ledger.StorageFaultException;
import com.flagship.value_ledger.loyalty.EarnResult;
import com.flagship.value_ledger.loyalty.LoyaltyAccountService;
import com.flagship.value_ledger.observability.CorrelationContext;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Acknowledgment rules of the purchase consumer: everything is acknowledged
 * except storage failures, which must be redelivered.
 */
class PurchaseEventConsumerTest {

    private LoyaltyAccountService loyaltyService;
    private Acknowledgment ack;
    private PurchaseEventConsumer consumer;
    private UUID userId;

    @BeforeEach
    void setUp() {
        loyaltyService = mock(LoyaltyAccountService.class);
        ack = mock(Acknowledgment.class);
        ObjectMapper objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        consumer = new PurchaseEventConsumer(loyaltyService, objectMapper);
        userId = UUID.randomUUID();
    }

    private ConsumerRecord<String, String> record(String json) {
        return new ConsumerRecord<>("purchases-settled", 0, 42L, "pay-1", json);
    }

    private String purchase(long amount, String source) {
        return "{\"eventId\":\"" + UUID.randomUUID() + "\",\"paymentId\":\"pay-1\",\"userId\":\"" + userId
                + "\",\"amount\":" + amount
                + (source != null ? ",\"source\":\"" + source + "\"" : "")
                + ",\"occurredAt\":\"2025-06-01T12:00:00Z\",\"merchantName\":\"Cafe\"}";
    }

    private static EarnResult earned(long points) {
        return new EarnResult(UUID.randomUUID(), points, points, BigDecimal.ONE, points, points,
                "bronze", false, Instant.now());
    }

    @Test
    @DisplayName("A settled purchase earns points and is acknowledged")
    void testPurchaseEarnsPoints() {
        when(loyaltyService.earn(userId, 25_000, "pay-1", "purchase"))
                .thenReturn(LedgerResult.success(earned(250)));

        consumer.consume(record(purchase(25_000, null)), ack);

        verify(loyaltyService).earn(userId, 25_000, "pay-1", "purchase");
        verify(ack).acknowledge();
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY), "MDC must be cleared");
    }

    @Test
    @DisplayName("The event's own source is passed through")
    void testSourcePassedThrough() {
        when(loyaltyService.earn(any(), anyLong(), anyString(), anyString()))
                .thenReturn(LedgerResult.success(earned(10)));

        consumer.consume(record(purchase(1_000, "delivery")), ack);

        verify(loyaltyService).earn(userId, 1_000, "pay-1", "delivery");
    }

    @Test
    @DisplayName("A replayed purchase is acknowledged without error")
    void testReplayAcknowledged() {
        when(loyaltyService.earn(any(), anyLong(), anyString(), anyString()))
                .thenReturn(LedgerResult.failure(LedgerError.DUPLICATE_OPERATION, "earn with reference pay-1 already recorded"));

        consumer.consume(record(purchase(25_000, null)), ack);

        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparseable payloads are skipped")
    void testUnparseableSkipped() {
        consumer.consume(record("not json"), ack);
        consumer.consume(record(null), ack);

        verify(loyaltyService, never()).earn(any(), anyLong(), any(), any());
        verify(ack, times(2)).acknowledge();
    }

    @Test
    @DisplayName("Invalid purchases are skipped")
    void testInvalidPurchaseSkipped() {
        when(loyaltyService.earn(any(), eq(0L), anyString(), anyString()))
                .thenThrow(new IllegalArgumentException("Amount spent must be positive"));

        consumer.consume(record(purchase(0, null)), ack);
        consumer.consume(record("{\"paymentId\":\"pay-2\",\"amount\":100}"), ack);

        verify(ack, times(2)).acknowledge();
    }

    @Test
    @DisplayName("Storage failures are not acknowledged so the purchase is redelivered")
    void testStorageFaultNotAcknowledged() {
        when(loyaltyService.earn(any(), anyLong(), anyString(), anyString()))
                .thenThrow(new StorageFaultException("Storage failure during loyalty.earn", null));

        assertThrows(StorageFaultException.class, () -> consumer.consume(record(purchase(25_000, null)), ack));

        verify(ack, never()).acknowledge();
        assertNull(MDC.get(CorrelationContext.USER_ID_MDC_KEY));
    }
}
