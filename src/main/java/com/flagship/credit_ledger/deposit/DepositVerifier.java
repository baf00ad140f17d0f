package com.flagship.credit_ledger.deposit;

import com.flagship.credit_ledger.ledger.LedgerService;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.support.RetryPolicy;
import com.flagship.credit_ledger.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Checks a transaction hash against the chain and yields a {@link Verdict}.
 *
 * Provider failures are retried with exponential backoff up to the policy's
 * attempt limit, then reported as PROVIDER_ERROR. The loop only pauses between
 * attempts; interrupting the calling thread there cancels verification with
 * {@link VerificationCancelledException}. The verifier never touches the ledger
 * and holds no locks. Transferred amounts are truncated to the ledger's scale.
 */
@Component
@Slf4j
public class DepositVerifier {

    private final ChainLookup chainLookup;
    private final LedgerMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final long requiredConfirmations;
    private final BigDecimal tolerance;

    @Autowired
    public DepositVerifier(ChainLookup chainLookup,
                           LedgerMetrics metrics,
                           @Value("${deposit.required-confirmations:1}") long requiredConfirmations,
                           @Value("${deposit.tolerance:0.01}") BigDecimal tolerance,
                           @Value("${deposit.verification.max-attempts:5}") int maxAttempts,
                           @Value("${deposit.verification.initial-backoff-ms:500}") long initialBackoffMs,
                           @Value("${deposit.verification.max-backoff-ms:8000}") long maxBackoffMs) {
        this(chainLookup, metrics, RetryPolicy.of(maxAttempts, initialBackoffMs, maxBackoffMs),
            Sleeper.THREAD, requiredConfirmations, tolerance);
    }

    DepositVerifier(ChainLookup chainLookup, LedgerMetrics metrics, RetryPolicy retryPolicy,
                    Sleeper sleeper, long requiredConfirmations, BigDecimal tolerance) {
        if (retryPolicy.isUnbounded()) {
            throw new IllegalArgumentException("Verification retries must be bounded");
        }
        if (tolerance.signum() < 0) {
            throw new IllegalArgumentException("Tolerance must not be negative");
        }
        this.chainLookup = chainLookup;
        this.metrics = metrics;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.requiredConfirmations = requiredConfirmations;
        this.tolerance = tolerance;
    }

    /**
     * @param txHash transaction hash to look up
     * @param expectedAddress address the transfer must be sent to
     * @param expectedAmount amount the claim expects, or null to accept any positive amount
     * @throws VerificationCancelledException if the thread is interrupted between attempts
     */
    public Verdict verify(String txHash, String expectedAddress, BigDecimal expectedAmount) {
        if (expectedAddress == null || expectedAddress.isBlank()) {
            throw new IllegalArgumentException("Expected deposit address is required");
        }

        int attempt = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new VerificationCancelledException(txHash);
            }
            attempt++;

            try {
                ChainTransfer transfer = chainLookup.lookup(txHash);
                Verdict verdict = evaluate(transfer, expectedAddress, expectedAmount, attempt);
                metrics.recordVerdict(verdict.getOutcome().name());
                log.info("Deposit verdict: txHash={}, outcome={}, actual={}, expected={}, attempts={}",
                        txHash, verdict.getOutcome(), verdict.getActualAmount(), expectedAmount, attempt);
                return verdict;

            } catch (ChainLookupException e) {
                metrics.recordChainLookupFailure("provider_error");

                if (!retryPolicy.allowsRetryAfter(attempt)) {
                    log.error("Chain lookup failed permanently: txHash={}, attempts={}, error={}",
                            txHash, attempt, e.getMessage());
                    metrics.recordVerdict(Verdict.Outcome.PROVIDER_ERROR.name());
                    return Verdict.providerError(e.getMessage(), attempt);
                }

                Duration backoff = retryPolicy.backoffAfter(attempt);
                log.warn("Chain lookup failed, retrying: txHash={}, attempt={}, backoff={}ms, error={}",
                        txHash, attempt, backoff.toMillis(), e.getMessage());
                pause(txHash, backoff);
            }
        }
    }

    Verdict evaluate(ChainTransfer transfer, String expectedAddress, BigDecimal expectedAmount, int attempts) {
        if (!transfer.isFound()) {
            return Verdict.notFound("transaction not found or carries no token transfer", attempts);
        }
        if (transfer.getToAddress() == null || !expectedAddress.trim().equals(transfer.getToAddress().trim())) {
            return Verdict.notFound("transfer is not addressed to the deposit wallet", attempts);
        }
        BigDecimal actual = transfer.getAmount() == null ? null : LedgerService.toLedgerScale(transfer.getAmount());
        if (actual == null || actual.signum() <= 0) {
            return Verdict.notFound("transfer carries no amount", attempts);
        }
        if (transfer.getConfirmations() < requiredConfirmations) {
            return Verdict.pending(transfer.getConfirmations(), requiredConfirmations, attempts);
        }
        if (expectedAmount == null || actual.compareTo(expectedAmount.subtract(tolerance)) >= 0) {
            return Verdict.confirmed(actual, attempts);
        }
        return Verdict.underpaid(actual, attempts);
    }

    private void pause(String txHash, Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Deposit verification cancelled: txHash={}", txHash);
            throw new VerificationCancelledException(txHash);
        }
    }
}
