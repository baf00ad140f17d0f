package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RedeemVoucherRequest {

    @NotBlank(message = "User key is required")
    @JsonProperty("user_key")
    String userKey;

    @NotBlank(message = "Voucher code is required")
    @JsonProperty("code")
    String code;
}
