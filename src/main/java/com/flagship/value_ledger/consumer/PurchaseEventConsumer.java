package com.flagship.value_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.loyalty.EarnResult;
import com.flagship.value_ledger.loyalty.LoyaltyAccountService;
import com.flagship.value_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Earns loyalty points for settled purchases.
 *
 * Offsets are committed manually. A message is acknowledged once its points
 * are journaled, when the journal already holds them (a replay), or when the
 * payload can never be processed. Storage failures propagate without an
 * acknowledgment so the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PurchaseEventConsumer {

    static final String EARN_SOURCE = "purchase";

    private final LoyaltyAccountService loyaltyService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.purchases:purchases-settled}",
        groupId = "${spring.kafka.consumer.group-id:value-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        PurchaseSettledEvent event = parse(record.value());
        if (event == null) {
            log.warn("Could not parse purchase event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY,
                event.getEventId() != null ? event.getEventId().toString() : CorrelationContext.newCorrelationId());
        if (event.getUserId() != null) {
            MDC.put(CorrelationContext.USER_ID_MDC_KEY, event.getUserId().toString());
        }
        try {
            handle(event);
            ack.acknowledge();
        } catch (IllegalArgumentException e) {
            log.warn("Rejected purchase event paymentId={}: {}", event.getPaymentId(), e.getMessage());
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing purchase event at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged, the message will be redelivered
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    private void handle(PurchaseSettledEvent event) {
        if (event.getUserId() == null) {
            throw new IllegalArgumentException("Purchase event has no userId");
        }
        String source = event.getSource() != null ? event.getSource() : EARN_SOURCE;
        LedgerResult<EarnResult> result =
                loyaltyService.earn(event.getUserId(), event.getAmount(), event.getPaymentId(), source);

        if (result.isSuccess()) {
            log.info("Processed purchase: paymentId={}, points={}",
                    event.getPaymentId(), result.getValue().getEarnedPoints());
        } else if (result.isDuplicate()) {
            log.info("Purchase already credited, skipping: paymentId={}", event.getPaymentId());
        } else {
            log.warn("Purchase not credited: paymentId={}, error={}, message={}",
                    event.getPaymentId(), result.getError(), result.getMessage());
        }
    }

    private PurchaseSettledEvent parse(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, PurchaseSettledEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse purchase event: {}", e.getMessage());
            return null;
        }
    }
}
