package com.flagship.credit_ledger.deposit;

/**
 * Transient failure of the chain lookup provider. Callers retry with backoff.
 */
public class ChainLookupException extends RuntimeException {

    public ChainLookupException(String message) {
        super(message);
    }

    public ChainLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
