package com.flagship.credit_ledger.ledger;

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
 * JPA entity for accounts.
 *
 * No setters: balances move only through {@link #apply(Asset, BigDecimal)},
 * which also advances the per-account event sequence. Callers must hold the
 * row lock (see {@link AccountRepository#findByIdForUpdate(UUID)}).
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_key", nullable = false, updatable = false, unique = true, length = 128)
    private String userKey;

    @Column(name = "funds_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal fundsBalance;

    @Column(name = "credit_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal creditBalance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AccountStatus status;

    @Column(name = "event_sequence", nullable = false)
    private long eventSequence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity open(String userKey) {
        return new AccountEntity(
            UUID.randomUUID(),
            userKey,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            AccountStatus.ACTIVE,
            0L,
            null, // set by @PrePersist
            null
        );
    }

    public Account toDomain() {
        return new Account(id, userKey, fundsBalance, creditBalance, status, eventSequence, createdAt);
    }

    BigDecimal balanceOf(Asset asset) {
        return asset == Asset.FUNDS ? fundsBalance : creditBalance;
    }

    /**
     * Applies a signed amount to one balance and returns the next event sequence number.
     *
     * @throws IllegalStateException if the resulting balance would be negative
     */
    long apply(Asset asset, BigDecimal signedAmount) {
        BigDecimal next = balanceOf(asset).add(signedAmount);
        if (next.signum() < 0) {
            throw new IllegalStateException(
                String.format("Balance of %s for account %s would become negative: %s", asset, id, next));
        }
        if (asset == Asset.FUNDS) {
            this.fundsBalance = next;
        } else {
            this.creditBalance = next;
        }
        this.eventSequence++;
        return this.eventSequence;
    }

    void changeStatus(AccountStatus status) {
        this.status = status;
    }
}
