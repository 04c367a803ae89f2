package com.flagship.value_ledger.delivery;

import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.wallet.CurrencyMutation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of delivery refunds.
 */
@WebMvcTest(DeliveryController.class)
class DeliveryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DeliveryPaymentService deliveryService;

    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("A refund without a body refunds what was paid")
    void testRefundWithoutBody() throws Exception {
        when(deliveryService.refundOrder(eq(userId), eq("order-1"), isNull()))
                .thenReturn(LedgerResult.success(new CurrencyMutation(UUID.randomUUID(), "refund", 18_000, 50_000)));

        mockMvc.perform(post("/api/delivery/orders/order-1/refund")
                        .header("X-User-Id", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delta").value(18000))
                .andExpect(jsonPath("$.newBalance").value(50000));
    }

    @Test
    @DisplayName("A refund total that differs from the payment maps to 422")
    void testRefundAmountMismatch() throws Exception {
        when(deliveryService.refundOrder(userId, "order-1", 1_000_000L))
                .thenReturn(LedgerResult.failure(LedgerError.REFUND_AMOUNT_MISMATCH,
                        "Order order-1 was paid 100, refund of 1000000 refused"));

        mockMvc.perform(post("/api/delivery/orders/order-1/refund")
                        .header("X-User-Id", userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"total\":1000000}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("REFUND_AMOUNT_MISMATCH"));
    }

    @Test
    @DisplayName("Refunding an order the user never paid maps to 404")
    void testRefundUnknownOrder() throws Exception {
        when(deliveryService.refundOrder(any(), any(), any()))
                .thenReturn(LedgerResult.failure(LedgerError.NOT_FOUND, "No payment recorded for order order-9"));

        mockMvc.perform(post("/api/delivery/orders/order-9/refund")
                        .header("X-User-Id", userId.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
