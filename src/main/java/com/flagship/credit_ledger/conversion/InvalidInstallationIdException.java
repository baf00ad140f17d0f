package com.flagship.credit_ledger.conversion;

/**
 * The installation id is malformed or the provider refused it. Never retried.
 */
public class InvalidInstallationIdException extends RuntimeException {

    public InvalidInstallationIdException(String message) {
        super(message);
    }
}
