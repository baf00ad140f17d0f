package com.flagship.credit_ledger.voucher;

import com.flagship.credit_ledger.ledger.Asset;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
@Table(name = "vouchers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VoucherEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, unique = true, length = 32)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Asset asset;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VoucherStatus status;

    @Column(name = "redeemed_by")
    private UUID redeemedBy;

    @Column(name = "redeemed_at")
    private Instant redeemedAt;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "created_by", nullable = false, updatable = false, length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static VoucherEntity fromDomain(Voucher voucher) {
        return new VoucherEntity(
            voucher.getId(),
            voucher.getCode(),
            voucher.getValue().getAsset(),
            voucher.getValue().getAmount(),
            voucher.getStatus(),
            voucher.getRedeemedBy(),
            voucher.getRedeemedAt(),
            voucher.getExpiresAt(),
            voucher.getCreatedBy(),
            voucher.getCreatedAt()
        );
    }

    public Voucher toDomain() {
        return new Voucher(id, code, new VoucherValue(asset, amount), status, redeemedBy, redeemedAt,
            expiresAt, createdBy, createdAt);
    }

    /**
     * The only mutation a voucher ever sees: UNUSED -> USED.
     */
    void markRedeemed(Voucher redeemed) {
        if (this.status != VoucherStatus.UNUSED || redeemed.getStatus() != VoucherStatus.USED) {
            throw new IllegalStateException("Voucher " + code + " can only be redeemed once");
        }
        this.status = VoucherStatus.USED;
        this.redeemedBy = redeemed.getRedeemedBy();
        this.redeemedAt = redeemed.getRedeemedAt();
    }
}
