package com.flagship.credit_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.pricing.PackageOrder;
import com.flagship.credit_ledger.pricing.PackageOrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PackageOrderResponse {

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("package_id")
    String packageId;

    @JsonProperty("cost")
    BigDecimal cost;

    @JsonProperty("required_payment")
    BigDecimal requiredPayment;

    @JsonProperty("deposit_address")
    String depositAddress;

    @JsonProperty("status")
    PackageOrderStatus status;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static PackageOrderResponse from(PackageOrder order, String depositAddress) {
        return PackageOrderResponse.builder()
            .orderId(order.getId())
            .packageId(order.getPackageId())
            .cost(order.getCost())
            .requiredPayment(order.getRequiredPayment())
            .depositAddress(depositAddress)
            .status(order.getStatus())
            .expiresAt(order.getExpiresAt())
            .build();
    }
}
