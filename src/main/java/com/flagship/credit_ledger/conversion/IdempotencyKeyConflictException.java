package com.flagship.credit_ledger.conversion;

/**
 * Idempotency key already used by a conversion of another account.
 */
public class IdempotencyKeyConflictException extends RuntimeException {

    public IdempotencyKeyConflictException(String idempotencyKey) {
        super("Idempotency key " + idempotencyKey + " belongs to another account's conversion");
    }
}
