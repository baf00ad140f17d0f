package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("user_key")
    String userKey;

    @JsonProperty("funds_balance")
    BigDecimal fundsBalance;

    @JsonProperty("credit_balance")
    BigDecimal creditBalance;

    @JsonProperty("status")
    AccountStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .accountId(account.getId())
            .userKey(account.getUserKey())
            .fundsBalance(account.getFundsBalance())
            .creditBalance(account.getCreditBalance())
            .status(account.getStatus())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
