package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.voucher.Voucher;
import com.flagship.credit_ledger.voucher.VoucherStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class VoucherResponse {

    @JsonProperty("code")
    String code;

    @JsonProperty("asset")
    Asset asset;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    VoucherStatus status;

    @JsonProperty("expired")
    boolean expired;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("redeemed_at")
    Instant redeemedAt;

    public static VoucherResponse from(Voucher voucher) {
        return VoucherResponse.builder()
            .code(voucher.getCode())
            .asset(voucher.getValue().getAsset())
            .amount(voucher.getValue().getAmount())
            .status(voucher.getStatus())
            .expired(voucher.isExpired(Instant.now()))
            .expiresAt(voucher.getExpiresAt())
            .redeemedAt(voucher.getRedeemedAt())
            .build();
    }
}
