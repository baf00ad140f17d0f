package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one balance-affecting operation.
 *
 * Key invariant: for every account and asset, the sum of event amounts equals
 * the current balance, and {@code resultingBalance} is the balance right after
 * this event was applied.
 */
@Value
public class LedgerEvent {
    UUID id;
    UUID accountId;
    Asset asset;
    LedgerEventKind kind;
    BigDecimal amount;           // signed: negative for debits
    BigDecimal resultingBalance;
    String externalReference;
    long sequenceNumber;
    String description;
    Instant createdAt;
}
