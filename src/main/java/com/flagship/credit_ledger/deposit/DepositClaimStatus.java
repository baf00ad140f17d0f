package com.flagship.credit_ledger.deposit;

/**
 * PENDING -> VERIFIED -> CREDITED, or PENDING -> REJECTED.
 * VERIFIED is a transient bridge: a verified claim is credited, possibly after retries.
 */
public enum DepositClaimStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    CREDITED
}
