package com.flagship.value_ledger.wallet.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class CreateVoucherRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 64, message = "Code must be at most 64 characters")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    String name;

    @NotNull(message = "Amount is required")
    @Min(value = 1, message = "Amount must be positive")
    Long amount;

    @NotNull(message = "Usage limit is required")
    @Min(value = 1, message = "Usage limit must be positive")
    Integer usageLimit;

    @NotNull(message = "validFrom is required")
    Instant validFrom;

    @NotNull(message = "validUntil is required")
    Instant validUntil;
}
