package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.support.RetryPolicy;
import com.flagship.credit_ledger.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Re-runs an idempotent ledger step while storage fails transiently.
 *
 * Used for credits that must not be abandoned once their precondition holds
 * (verified deposit, redeemed voucher, released reservation). With the default
 * policy it retries until the step succeeds or the thread is interrupted.
 */
@Component
@Slf4j
public class StorageRetryExecutor {

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final LedgerMetrics metrics;

    @Autowired
    public StorageRetryExecutor(LedgerMetrics metrics,
                                @Value("${ledger.credit-retry.max-attempts:0}") int maxAttempts,
                                @Value("${ledger.credit-retry.initial-backoff-ms:200}") long initialBackoffMs,
                                @Value("${ledger.credit-retry.max-backoff-ms:30000}") long maxBackoffMs) {
        this(RetryPolicy.of(maxAttempts, initialBackoffMs, maxBackoffMs), Sleeper.THREAD, metrics);
    }

    StorageRetryExecutor(RetryPolicy retryPolicy, Sleeper sleeper, LedgerMetrics metrics) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * @param operation metric tag for the step
     * @param reference external reference, logged on every failure
     */
    public <T> T execute(String operation, String reference, Supplier<T> step) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return step.get();
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    throw e;
                }
                if (!retryPolicy.allowsRetryAfter(attempt)) {
                    log.error("Ledger step abandoned after {} attempts, manual reconciliation required: operation={}, reference={}, error={}",
                            attempt, operation, reference, e.getMessage());
                    throw e;
                }

                metrics.recordCreditRetry(operation);
                Duration backoff = retryPolicy.backoffAfter(attempt);
                log.warn("Ledger step failed on storage, retrying: operation={}, reference={}, attempt={}, backoff={}ms, error={}",
                        operation, reference, attempt, backoff.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    log.error("Ledger step interrupted, manual reconciliation required: operation={}, reference={}",
                            operation, reference);
                    throw e;
                }
            }
        }
    }

    static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
            || e instanceof RecoverableDataAccessException
            || e instanceof DataAccessResourceFailureException
            || e instanceof CannotCreateTransactionException;
    }
}
