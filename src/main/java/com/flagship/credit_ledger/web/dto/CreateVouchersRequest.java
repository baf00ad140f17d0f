package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Asset;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateVouchersRequest {

    @Min(value = 1, message = "Count must be at least 1")
    @Max(value = 100, message = "Count must be at most 100")
    @JsonProperty("count")
    int count;

    @NotNull(message = "Asset is required")
    @JsonProperty("asset")
    Asset asset;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("prefix")
    String prefix;

    @Min(value = 1, message = "Expiry must be at least one day")
    @JsonProperty("expires_in_days")
    Integer expiresInDays;
}
