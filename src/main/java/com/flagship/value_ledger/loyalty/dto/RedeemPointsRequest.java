package com.flagship.value_ledger.loyalty.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RedeemPointsRequest {

    @NotNull(message = "Points are required")
    @Min(value = 100, message = "Minimum 100 points required for redemption")
    Long points;
}
