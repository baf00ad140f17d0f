package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.pricing.CatalogSnapshot;
import com.flagship.credit_ledger.pricing.PackagePrice;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class PackageResponse {

    @JsonProperty("package_id")
    String packageId;

    @JsonProperty("name")
    String name;

    @JsonProperty("unit_count")
    BigDecimal unitCount;

    @JsonProperty("cost")
    BigDecimal cost;

    public static PackageResponse from(PackagePrice price) {
        return PackageResponse.builder()
            .packageId(price.getPackageId())
            .name(price.getName())
            .unitCount(price.getUnitCount())
            .cost(price.getCost())
            .build();
    }

    @Value
    public static class Catalog {
        @JsonProperty("version")
        long version;

        @JsonProperty("packages")
        List<PackageResponse> packages;

        public static Catalog from(CatalogSnapshot snapshot) {
            return new Catalog(snapshot.getVersion(), snapshot.list().stream().map(PackageResponse::from).toList());
        }
    }
}
