package com.flagship.value_ledger.wallet.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ChargeRequest {

    @NotNull(message = "Amount is required")
    @Min(value = 1000, message = "Amount must be between 1,000 and 3,000,000")
    @Max(value = 3000000, message = "Amount must be between 1,000 and 3,000,000")
    Long amount;
}
