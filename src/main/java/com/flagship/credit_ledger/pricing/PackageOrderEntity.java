package com.flagship.credit_ledger.pricing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "package_orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PackageOrderEntity {

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

    @Column(name = "required_payment", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal requiredPayment;

    @Column(name = "catalog_version", nullable = false, updatable = false)
    private long catalogVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PackageOrderStatus status;

    @Column(name = "purchase_id")
    private UUID purchaseId;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PackageOrderEntity fromDomain(PackageOrder order) {
        return new PackageOrderEntity(
            order.getId(),
            order.getAccountId(),
            order.getPackageId(),
            order.getUnitCount(),
            order.getCost(),
            order.getRequiredPayment(),
            order.getCatalogVersion(),
            order.getStatus(),
            order.getPurchaseId(),
            order.getExpiresAt(),
            order.getCreatedAt(),
            null
        );
    }

    PackageOrder toDomain() {
        return new PackageOrder(id, accountId, packageId, unitCount, cost, requiredPayment, catalogVersion,
            status, purchaseId, expiresAt, createdAt);
    }

    void updateFromDomain(PackageOrder order) {
        this.status = order.getStatus();
        this.purchaseId = order.getPurchaseId();
    }
}
