package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Asset;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * A positive amount credits, a negative amount debits.
 */
@Value
@Builder
@Jacksonized
public class AdjustBalanceRequest {

    @NotBlank(message = "User key is required")
    @JsonProperty("user_key")
    String userKey;

    @NotNull(message = "Asset is required")
    @JsonProperty("asset")
    Asset asset;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
