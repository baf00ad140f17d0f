package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.voucher.VoucherStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class VoucherStatsResponse {

    @JsonProperty("total")
    long total;

    @JsonProperty("used")
    long used;

    @JsonProperty("active")
    long active;

    @JsonProperty("expired")
    long expired;

    @JsonProperty("outstanding_value")
    Map<Asset, BigDecimal> outstandingValue;

    public static VoucherStatsResponse from(VoucherStats stats) {
        return VoucherStatsResponse.builder()
            .total(stats.getTotal())
            .used(stats.getUsed())
            .active(stats.getActive())
            .expired(stats.getExpired())
            .outstandingValue(stats.getOutstandingValue())
            .build();
    }
}
