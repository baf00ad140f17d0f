package com.flagship.credit_ledger.pricing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "package_prices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PackagePriceEntity {

    @Id
    @Column(name = "package_id", nullable = false, updatable = false, length = 64)
    private String packageId;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "unit_count", nullable = false, precision = 19, scale = 4)
    private BigDecimal unitCount;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal cost;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "catalog_version", nullable = false)
    private long catalogVersion;

    static PackagePriceEntity fromDomain(PackagePrice price, long catalogVersion) {
        return new PackagePriceEntity(price.getPackageId(), price.getName(), price.getUnitCount(),
            price.getCost(), price.getSortOrder(), catalogVersion);
    }

    PackagePrice toDomain() {
        return new PackagePrice(packageId, name, unitCount, cost, sortOrder);
    }
}
