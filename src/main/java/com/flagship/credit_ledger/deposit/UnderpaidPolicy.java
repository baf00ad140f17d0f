package com.flagship.credit_ledger.deposit;

/**
 * What to do with a transfer smaller than the expected amount (beyond tolerance).
 */
public enum UnderpaidPolicy {
    /** Credit what actually arrived and close the claim as credited. */
    CREDIT_ACTUAL,
    /** Reject the claim; nothing is credited. */
    REJECT
}
