package com.flagship.credit_ledger.conversion;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Links a balance reservation to the outcome of one external conversion call.
 *
 * The reservation is a real debit taken at request time; finalizing changes no
 * balance, releasing is a compensating REFUND credit with the same reference.
 */
@Value
public class ConversionDebit {
    UUID requestId;
    UUID accountId;
    String installationId;
    BigDecimal reservedAmount;
    ConversionDebitStatus status;
    String idempotencyKey;
    String confirmationId;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    public static ConversionDebit reserve(UUID requestId, UUID accountId, String installationId,
                                          BigDecimal amount, String idempotencyKey) {
        Instant now = Instant.now();
        return new ConversionDebit(requestId, accountId, installationId, amount, ConversionDebitStatus.RESERVED,
            idempotencyKey, null, null, now, now);
    }

    public ConversionDebit finalizeWith(String confirmationId) {
        if (status != ConversionDebitStatus.RESERVED) {
            throw new IllegalStateException(String.format(
                "Cannot finalize conversion %s in %s status. Only RESERVED debits can be finalized.", requestId, status));
        }
        return new ConversionDebit(requestId, accountId, installationId, reservedAmount, ConversionDebitStatus.FINALIZED,
            idempotencyKey, confirmationId, null, createdAt, Instant.now());
    }

    public ConversionDebit release(String reason) {
        if (status != ConversionDebitStatus.RESERVED) {
            throw new IllegalStateException(String.format(
                "Cannot release conversion %s in %s status. Only RESERVED debits can be released.", requestId, status));
        }
        return new ConversionDebit(requestId, accountId, installationId, reservedAmount, ConversionDebitStatus.RELEASED,
            idempotencyKey, null, reason, createdAt, Instant.now());
    }

    public boolean isTerminal() {
        return status != ConversionDebitStatus.RESERVED;
    }

    /**
     * Ledger reference shared by the reservation debit and its refund.
     */
    public String ledgerReference() {
        return requestId.toString();
    }
}
