package com.flagship.credit_ledger.deposit;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of checking a deposit claim against the chain.
 *
 * CONFIRMED and UNDERPAID carry the actual transferred amount. What to do with
 * an underpayment is decided by the caller, not the verifier.
 */
@Value
public class Verdict {

    public enum Outcome {
        CONFIRMED,
        UNDERPAID,
        NOT_FOUND,
        PENDING,
        PROVIDER_ERROR
    }

    Outcome outcome;
    BigDecimal actualAmount;
    String detail;
    int attempts;

    public static Verdict confirmed(BigDecimal actual, int attempts) {
        return new Verdict(Outcome.CONFIRMED, actual, null, attempts);
    }

    public static Verdict underpaid(BigDecimal actual, int attempts) {
        return new Verdict(Outcome.UNDERPAID, actual, null, attempts);
    }

    public static Verdict notFound(String detail, int attempts) {
        return new Verdict(Outcome.NOT_FOUND, null, detail, attempts);
    }

    public static Verdict pending(long confirmations, long required, int attempts) {
        return new Verdict(Outcome.PENDING, null,
            String.format("%d of %d confirmations", confirmations, required), attempts);
    }

    public static Verdict providerError(String detail, int attempts) {
        return new Verdict(Outcome.PROVIDER_ERROR, null, detail, attempts);
    }
}
