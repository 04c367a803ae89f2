package com.flagship.value_ledger.wallet.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RedeemVoucherRequest {

    @NotBlank(message = "Voucher code is required")
    String code;
}
