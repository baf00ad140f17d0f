package com.flagship.credit_ledger.deposit;

/**
 * The transaction hash is already claimed by a different account.
 */
public class DepositClaimConflictException extends RuntimeException {

    public DepositClaimConflictException(String txHash) {
        super("Transaction " + txHash + " has already been claimed by another account");
    }
}
