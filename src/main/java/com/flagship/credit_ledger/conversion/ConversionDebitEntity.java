package com.flagship.credit_ledger.conversion;

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
@Table(name = "conversion_debits")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversionDebitEntity {

    @Id
    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "installation_id", nullable = false, updatable = false, length = 63)
    private String installationId;

    @Column(name = "reserved_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal reservedAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ConversionDebitStatus status;

    @Column(name = "idempotency_key", nullable = false, updatable = false, unique = true, length = 128)
    private String idempotencyKey;

    @Column(name = "confirmation_id")
    private String confirmationId;

    @Column(name = "failure_reason")
    private String failureReason;

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

    static ConversionDebitEntity fromDomain(ConversionDebit debit) {
        return new ConversionDebitEntity(
            debit.getRequestId(),
            debit.getAccountId(),
            debit.getInstallationId(),
            debit.getReservedAmount(),
            debit.getStatus(),
            debit.getIdempotencyKey(),
            debit.getConfirmationId(),
            debit.getFailureReason(),
            debit.getCreatedAt(),
            null
        );
    }

    public ConversionDebit toDomain() {
        return new ConversionDebit(requestId, accountId, installationId, reservedAmount, status,
            idempotencyKey, confirmationId, failureReason, createdAt, updatedAt);
    }

    /**
     * Only status, confirmation id and failure reason change after reservation.
     */
    void updateFromDomain(ConversionDebit debit) {
        this.status = debit.getStatus();
        this.confirmationId = debit.getConfirmationId();
        this.failureReason = debit.getFailureReason();
    }
}
