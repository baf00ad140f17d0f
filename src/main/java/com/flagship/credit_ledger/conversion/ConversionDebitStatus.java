package com.flagship.credit_ledger.conversion;

/**
 * RESERVED -> FINALIZED on provider success, RESERVED -> RELEASED on failure or timeout.
 */
public enum ConversionDebitStatus {
    RESERVED,
    FINALIZED,
    RELEASED
}
