package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEvent;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEventResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("asset")
    Asset asset;

    @JsonProperty("kind")
    LedgerEventKind kind;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("resulting_balance")
    BigDecimal resultingBalance;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEventResponse from(LedgerEvent event) {
        return LedgerEventResponse.builder()
            .id(event.getId())
            .asset(event.getAsset())
            .kind(event.getKind())
            .amount(event.getAmount())
            .resultingBalance(event.getResultingBalance())
            .externalReference(event.getExternalReference())
            .sequenceNumber(event.getSequenceNumber())
            .description(event.getDescription())
            .createdAt(event.getCreatedAt())
            .build();
    }
}
