package com.flagship.credit_ledger.pricing;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PackagePurchase {
    UUID id;
    UUID accountId;
    String packageId;
    BigDecimal unitCount;
    BigDecimal cost;
    long catalogVersion;
    Instant createdAt;
}
