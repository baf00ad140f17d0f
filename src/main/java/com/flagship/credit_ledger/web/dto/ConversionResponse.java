package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.conversion.ConversionDebit;
import com.flagship.credit_ledger.conversion.ConversionDebitStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ConversionResponse {

    @JsonProperty("request_id")
    UUID requestId;

    @JsonProperty("status")
    ConversionDebitStatus status;

    @JsonProperty("confirmation_id")
    String confirmationId;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("reserved_amount")
    BigDecimal reservedAmount;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ConversionResponse from(ConversionDebit debit) {
        return ConversionResponse.builder()
            .requestId(debit.getRequestId())
            .status(debit.getStatus())
            .confirmationId(debit.getConfirmationId())
            .failureReason(debit.getFailureReason())
            .reservedAmount(debit.getReservedAmount())
            .createdAt(debit.getCreatedAt())
            .build();
    }
}
