package com.flagship.credit_ledger.ledger;

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

/**
 * JPA entity for the append-only ledger log.
 *
 * Every column is updatable = false: events are written once and never changed.
 * The storage layer enforces UNIQUE(kind, external_reference).
 */
@Entity
@Table(name = "ledger_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Asset asset;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private LedgerEventKind kind;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "resulting_balance", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal resultingBalance;

    @Column(name = "external_reference", nullable = false, updatable = false, length = 128)
    private String externalReference;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @Column(updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static LedgerEventEntity record(UUID accountId, Asset asset, LedgerEventKind kind, BigDecimal amount,
                                    BigDecimal resultingBalance, String externalReference,
                                    long sequenceNumber, String description) {
        return new LedgerEventEntity(
            UUID.randomUUID(),
            accountId,
            asset,
            kind,
            amount,
            resultingBalance,
            externalReference,
            sequenceNumber,
            description,
            null // set by @PrePersist
        );
    }

    public LedgerEvent toDomain() {
        return new LedgerEvent(id, accountId, asset, kind, amount, resultingBalance,
            externalReference, sequenceNumber, description, createdAt);
    }
}
