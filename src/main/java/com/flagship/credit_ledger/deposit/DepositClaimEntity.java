package com.flagship.credit_ledger.deposit;

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

/**
 * JPA entity for deposit claims. tx_hash is UNIQUE in the schema: one claim per transaction.
 */
@Entity
@Table(name = "deposit_claims")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DepositClaimEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tx_hash", nullable = false, updatable = false, unique = true, length = 128)
    private String txHash;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "claimed_amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal claimedAmount;

    @Column(name = "expected_amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal expectedAmount;

    @Column(name = "verified_amount", precision = 19, scale = 4)
    private BigDecimal verifiedAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DepositClaimStatus status;

    @Column(name = "verification_attempts", nullable = false)
    private int verificationAttempts;

    @Column(name = "last_error")
    private String lastError;

    @Column(name = "review_required", nullable = false)
    private boolean reviewRequired;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "credited_at")
    private Instant creditedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static DepositClaimEntity fromDomain(DepositClaim claim) {
        return new DepositClaimEntity(
            claim.getId(),
            claim.getTxHash(),
            claim.getAccountId(),
            claim.getClaimedAmount(),
            claim.getExpectedAmount(),
            claim.getVerifiedAmount(),
            claim.getStatus(),
            claim.getVerificationAttempts(),
            claim.getLastError(),
            claim.isReviewRequired(),
            null, // set by @PrePersist
            null,
            claim.getCreditedAt()
        );
    }

    public DepositClaim toDomain() {
        return new DepositClaim(id, txHash, accountId, claimedAmount, expectedAmount, verifiedAmount,
            status, verificationAttempts, lastError, reviewRequired, createdAt, updatedAt, creditedAt);
    }

    /**
     * Copies the mutable state of a transitioned claim. Identity, account and amounts claimed are fixed.
     */
    void updateFromDomain(DepositClaim claim) {
        if (!toDomain().canTransitionTo(claim.getStatus())) {
            throw new IllegalStateException(String.format(
                "Deposit claim %s cannot move from %s to %s", txHash, status, claim.getStatus()));
        }
        this.verifiedAmount = claim.getVerifiedAmount();
        this.status = claim.getStatus();
        this.verificationAttempts = claim.getVerificationAttempts();
        this.lastError = claim.getLastError();
        this.reviewRequired = claim.isReviewRequired();
        this.creditedAt = claim.getCreditedAt();
    }
}
