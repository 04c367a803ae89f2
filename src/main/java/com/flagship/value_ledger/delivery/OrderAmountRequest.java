package com.flagship.value_ledger.delivery;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OrderAmountRequest {

    @NotNull(message = "Total is required")
    @Min(value = 1, message = "Total must be positive")
    Long total;
}
