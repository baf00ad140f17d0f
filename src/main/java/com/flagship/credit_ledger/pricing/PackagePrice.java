package com.flagship.credit_ledger.pricing;

import com.flagship.credit_ledger.ledger.LedgerService;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One catalog entry: a package of {@code unitCount} credits sold for {@code cost} funds.
 */
@Value
public class PackagePrice {
    String packageId;
    String name;
    BigDecimal unitCount;
    BigDecimal cost;
    int sortOrder;

    public static PackagePrice of(String packageId, String name, BigDecimal unitCount, BigDecimal cost, int sortOrder) {
        if (packageId == null || packageId.isBlank()) {
            throw new IllegalArgumentException("Package id is required");
        }
        if (unitCount == null || unitCount.signum() <= 0) {
            throw new IllegalArgumentException("Unit count must be positive for package " + packageId);
        }
        if (cost == null || cost.signum() <= 0) {
            throw new IllegalArgumentException("Cost must be positive for package " + packageId);
        }
        if (unitCount.stripTrailingZeros().scale() > LedgerService.AMOUNT_SCALE
                || cost.stripTrailingZeros().scale() > LedgerService.AMOUNT_SCALE) {
            throw new IllegalArgumentException("Amounts of package " + packageId + " exceed ledger precision");
        }
        return new PackagePrice(packageId.trim(), name == null || name.isBlank() ? packageId.trim() : name.trim(),
            unitCount, cost, sortOrder);
    }
}
