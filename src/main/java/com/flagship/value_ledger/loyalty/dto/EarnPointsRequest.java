package com.flagship.value_ledger.loyalty.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EarnPointsRequest {

    @NotNull(message = "Amount is required")
    @Min(value = 1, message = "Amount must be a positive integer")
    Long amount;

    @NotBlank(message = "Transaction ID is required")
    String transactionId;

    String source;
}
