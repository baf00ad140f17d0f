package com.flagship.credit_ledger.pricing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "package_purchases")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PackagePurchaseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "package_id", nullable = false, updatable = false, length = 64)
    private String packageId;

    @Column(name = "unit_count", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal unitCount;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal cost;

    @Column(name = "catalog_version", nullable = false, updatable = false)
    private long catalogVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static PackagePurchaseEntity record(UUID id, UUID accountId, String packageId, BigDecimal unitCount,
                                        BigDecimal cost, long catalogVersion) {
        return new PackagePurchaseEntity(id, accountId, packageId, unitCount, cost, catalogVersion, null);
    }

    PackagePurchase toDomain() {
        return new PackagePurchase(id, accountId, packageId, unitCount, cost, catalogVersion, createdAt);
    }
}
