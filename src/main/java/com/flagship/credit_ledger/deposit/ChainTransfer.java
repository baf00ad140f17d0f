package com.flagship.credit_ledger.deposit;

import lombok.Value;

import java.math.BigDecimal;

/**
 * What the chain knows about a transaction hash: the single-token transfer it
 * carries, if any, and how deep it is buried.
 */
@Value
public class ChainTransfer {
    boolean found;
    String toAddress;
    BigDecimal amount;
    long confirmations;

    public static ChainTransfer notFound() {
        return new ChainTransfer(false, null, null, 0);
    }

    public static ChainTransfer of(String toAddress, BigDecimal amount, long confirmations) {
        return new ChainTransfer(true, toAddress, amount, confirmations);
    }
}
