package com.flagship.credit_ledger.conversion;

/**
 * The conversion provider could not be reached or answered with a transient failure.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
