package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain view of an account.
 *
 * Accounts are created on first interaction and never deleted, only suspended.
 * Balances are only changed through {@link LedgerService}.
 */
@Value
public class Account {
    UUID id;
    String userKey;
    BigDecimal fundsBalance;
    BigDecimal creditBalance;
    AccountStatus status;
    long eventSequence;
    Instant createdAt;

    public BigDecimal balanceOf(Asset asset) {
        return switch (asset) {
            case FUNDS -> fundsBalance;
            case CREDITS -> creditBalance;
        };
    }

    public boolean isSuspended() {
        return status == AccountStatus.SUSPENDED;
    }
}
