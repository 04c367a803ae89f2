package com.flagship.value_ledger.rewards.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class CreateRewardRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    String name;

    String description;

    @NotBlank(message = "Reward type is required")
    @Pattern(regexp = "voucher|product|experience|cashback",
            message = "Reward type must be one of voucher, product, experience, cashback")
    String rewardType;

    @Min(value = 0, message = "Value must not be negative")
    Long value;

    @NotNull(message = "Points required is required")
    @Min(value = 1, message = "Points required must be positive")
    Long pointsRequired;

    @Min(value = 1, message = "Quantity must be positive")
    Integer quantity;

    Instant validUntil;
}
