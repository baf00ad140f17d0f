package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.pricing.PackagePurchase;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("purchase_id")
    UUID purchaseId;

    @JsonProperty("package_id")
    String packageId;

    @JsonProperty("unit_count")
    BigDecimal unitCount;

    @JsonProperty("cost")
    BigDecimal cost;

    @JsonProperty("catalog_version")
    long catalogVersion;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PurchaseResponse from(PackagePurchase purchase) {
        return PurchaseResponse.builder()
            .purchaseId(purchase.getId())
            .packageId(purchase.getPackageId())
            .unitCount(purchase.getUnitCount())
            .cost(purchase.getCost())
            .catalogVersion(purchase.getCatalogVersion())
            .createdAt(purchase.getCreatedAt())
            .build();
    }
}
