package com.flagship.value_ledger.loyalty.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class MerchantRedeemRequest {

    @NotNull(message = "Customer ID is required")
    UUID customerId;

    @NotNull(message = "Points are required")
    @Min(value = 1, message = "Points must be a positive integer")
    Long points;

    String description;
}
