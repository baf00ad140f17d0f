package com.flagship.credit_ledger.ledger;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Thrown when a debit exceeds the available balance. No state is changed.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID accountId;
    private final Asset asset;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(UUID accountId, Asset asset, BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient %s balance: available=%s, requested=%s",
            asset, available.stripTrailingZeros().toPlainString(), requested.stripTrailingZeros().toPlainString()));
        this.accountId = accountId;
        this.asset = asset;
        this.available = available;
        this.requested = requested;
    }
}
