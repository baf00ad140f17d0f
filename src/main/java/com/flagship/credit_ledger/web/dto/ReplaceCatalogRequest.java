package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.pricing.PackagePrice;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
@Jacksonized
public class ReplaceCatalogRequest {

    @Valid
    @NotEmpty(message = "At least one package is required")
    @JsonProperty("packages")
    List<Entry> packages;

    public List<PackagePrice> toPrices() {
        List<PackagePrice> prices = new ArrayList<>(packages.size());
        for (int i = 0; i < packages.size(); i++) {
            Entry entry = packages.get(i);
            prices.add(PackagePrice.of(entry.getPackageId(), entry.getName(), entry.getUnitCount(), entry.getCost(), i + 1));
        }
        return prices;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Entry {

        @NotBlank(message = "Package id is required")
        @JsonProperty("package_id")
        String packageId;

        @JsonProperty("name")
        String name;

        @NotNull(message = "Unit count is required")
        @DecimalMin(value = "1", message = "Unit count must be at least 1")
        @JsonProperty("unit_count")
        BigDecimal unitCount;

        @NotNull(message = "Cost is required")
        @DecimalMin(value = "0.01", message = "Cost must be greater than 0")
        @JsonProperty("cost")
        BigDecimal cost;
    }
}
