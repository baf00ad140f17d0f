package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class DepositClaimRequest {

    @NotBlank(message = "User key is required")
    @JsonProperty("user_key")
    String userKey;

    @NotBlank(message = "Transaction hash is required")
    @Size(max = 128, message = "Transaction hash is too long")
    @JsonProperty("tx_hash")
    String txHash;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;
}
