package com.flagship.credit_ledger.pricing;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A quoted package purchase waiting for a deposit to cover it.
 *
 * The price is fixed when the order opens; a later catalog replacement does
 * not change what the order costs.
 */
@Value
public class PackageOrder {
    UUID id;
    UUID accountId;
    String packageId;
    BigDecimal unitCount;
    BigDecimal cost;
    BigDecimal requiredPayment;
    long catalogVersion;
    PackageOrderStatus status;
    UUID purchaseId;
    Instant expiresAt;
    Instant createdAt;

    public static PackageOrder open(UUID accountId, PackagePrice price, long catalogVersion,
                                    BigDecimal availableFunds, Duration ttl) {
        BigDecimal shortfall = price.getCost().subtract(availableFunds);
        BigDecimal required = shortfall.signum() > 0 ? shortfall : BigDecimal.ZERO;
        Instant now = Instant.now();
        return new PackageOrder(UUID.randomUUID(), accountId, price.getPackageId(), price.getUnitCount(),
            price.getCost(), required, catalogVersion, PackageOrderStatus.OPEN, null, now.plus(ttl), now);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public PackageOrder complete(UUID purchaseId) {
        requireOpen("complete");
        return withStatus(PackageOrderStatus.COMPLETED, purchaseId);
    }

    public PackageOrder expire() {
        requireOpen("expire");
        return withStatus(PackageOrderStatus.EXPIRED, null);
    }

    public PackageOrder cancel() {
        requireOpen("cancel");
        return withStatus(PackageOrderStatus.CANCELLED, null);
    }

    private void requireOpen(String action) {
        if (status != PackageOrderStatus.OPEN) {
            throw new IllegalStateException(String.format(
                "Cannot %s package order %s in %s status", action, id, status));
        }
    }

    private PackageOrder withStatus(PackageOrderStatus newStatus, UUID newPurchaseId) {
        return new PackageOrder(id, accountId, packageId, unitCount, cost, requiredPayment, catalogVersion,
            newStatus, newPurchaseId, expiresAt, createdAt);
    }
}
