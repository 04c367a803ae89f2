package com.flagship.value_ledger.wallet.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CurrencyMutationRequest {

    @NotNull(message = "Delta is required")
    Long delta;

    @NotBlank(message = "Kind is required")
    @Pattern(regexp = "payment|refund|topup|adjust", message = "Kind must be one of payment, refund, topup, adjust")
    String kind;

    @Size(max = 255, message = "Reference ID must be at most 255 characters")
    String referenceId;

    String description;
}
