package com.flagship.credit_ledger.deposit;

/**
 * The verifying thread was interrupted between attempts. Nothing was changed.
 */
public class VerificationCancelledException extends RuntimeException {

    public VerificationCancelledException(String txHash) {
        super("Verification of " + txHash + " was cancelled");
    }
}
