package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ConversionRequest {

    @NotBlank(message = "User key is required")
    @JsonProperty("user_key")
    String userKey;

    @NotBlank(message = "Installation id is required")
    @JsonProperty("installation_id")
    String installationId;
}
