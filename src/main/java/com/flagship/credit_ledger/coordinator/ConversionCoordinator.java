package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.conversion.ConversionDebit;
import com.flagship.credit_ledger.conversion.ConversionDebitService;
import com.flagship.credit_ledger.conversion.ConversionProvider;
import com.flagship.credit_ledger.conversion.IdempotencyKeyConflictException;
import com.flagship.credit_ledger.conversion.IdempotencyService;
import com.flagship.credit_ledger.conversion.InstallationIdValidator;
import com.flagship.credit_ledger.conversion.InvalidInstallationIdException;
import com.flagship.credit_ledger.conversion.ProviderUnavailableException;
import com.flagship.credit_ledger.conversion.ReservationExpiredException;
import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.support.RetryPolicy;
import com.flagship.credit_ledger.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversion requests: reserve, call the provider with no lock held, then
 * finalize or release.
 *
 * A request is identified by the client's idempotency key; repeating it
 * returns the stored debit instead of reserving again.
 */
@Service
@Slf4j
public class ConversionCoordinator {

    private final AccountService accountService;
    private final ConversionDebitService debitService;
    private final ConversionProvider provider;
    private final InstallationIdValidator validator;
    private final IdempotencyService idempotencyService;
    private final StorageRetryExecutor retryExecutor;
    private final LedgerMetrics metrics;
    private final RetryPolicy providerRetry;
    private final Sleeper sleeper;
    private final BigDecimal unitCost;
    private final Duration reservationTimeout;

    @Autowired
    public ConversionCoordinator(AccountService accountService,
                                 ConversionDebitService debitService,
                                 ConversionProvider provider,
                                 InstallationIdValidator validator,
                                 IdempotencyService idempotencyService,
                                 StorageRetryExecutor retryExecutor,
                                 LedgerMetrics metrics,
                                 @Value("${conversion.unit-cost:1}") BigDecimal unitCost,
                                 @Value("${conversion.reservation-timeout:PT10M}") Duration reservationTimeout,
                                 @Value("${conversion.provider.max-attempts:3}") int maxAttempts,
                                 @Value("${conversion.provider.initial-backoff-ms:1000}") long initialBackoffMs,
                                 @Value("${conversion.provider.max-backoff-ms:4000}") long maxBackoffMs) {
        this(accountService, debitService, provider, validator, idempotencyService, retryExecutor, metrics,
            RetryPolicy.of(maxAttempts, initialBackoffMs, maxBackoffMs), Sleeper.THREAD, unitCost, reservationTimeout);
    }

    ConversionCoordinator(AccountService accountService, ConversionDebitService debitService,
                          ConversionProvider provider, InstallationIdValidator validator,
                          IdempotencyService idempotencyService, StorageRetryExecutor retryExecutor,
                          LedgerMetrics metrics, RetryPolicy providerRetry, Sleeper sleeper,
                          BigDecimal unitCost, Duration reservationTimeout) {
        if (providerRetry.isUnbounded()) {
            throw new IllegalArgumentException("Provider retries must be bounded");
        }
        if (unitCost.signum() <= 0) {
            throw new IllegalArgumentException("Conversion unit cost must be positive");
        }
        this.accountService = accountService;
        this.debitService = debitService;
        this.provider = provider;
        this.validator = validator;
        this.idempotencyService = idempotencyService;
        this.retryExecutor = retryExecutor;
        this.metrics = metrics;
        this.providerRetry = providerRetry;
        this.sleeper = sleeper;
        this.unitCost = unitCost;
        this.reservationTimeout = reservationTimeout;
    }

    /**
     * @return the debit in its final state: FINALIZED with a confirmation id, or RELEASED with a reason
     * @throws InvalidInstallationIdException if the id is malformed; nothing is reserved
     * @throws com.flagship.credit_ledger.ledger.InsufficientFundsException if credits are short
     * @throws com.flagship.credit_ledger.ledger.AccountSuspendedException if the account is suspended
     * @throws IdempotencyKeyConflictException if the key was used by another account
     */
    public ConversionDebit convert(String userKey, String installationId, String idempotencyKey) {
        Optional<ConversionDebit> previous = findPrevious(idempotencyKey);
        if (previous.isPresent()) {
            UUID callerId = accountService.findByUserKey(userKey).map(Account::getId).orElse(null);
            return replay(previous.get(), callerId, idempotencyKey);
        }
        metrics.recordIdempotencyMiss();

        String normalizedId;
        try {
            normalizedId = validator.normalize(installationId);
        } catch (InvalidInstallationIdException e) {
            metrics.recordConversion("invalid_input");
            throw e;
        }

        Account account = accountService.getOrCreate(userKey);
        UUID requestId = UUID.randomUUID();
        MDC.put(CorrelationContext.REQUEST_ID_MDC_KEY, requestId.toString());
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, account.getId().toString());
        long startTime = System.currentTimeMillis();
        try {
            ConversionDebit reserved;
            try {
                reserved = debitService.reserve(requestId, account.getId(), normalizedId, unitCost, idempotencyKey);
            } catch (DataIntegrityViolationException e) {
                // Same idempotency key reserved concurrently.
                ConversionDebit concurrent = findPrevious(idempotencyKey).orElseThrow(() -> e);
                return replay(concurrent, account.getId(), idempotencyKey);
            }
            idempotencyService.remember(idempotencyKey, requestId);

            return complete(reserved);
        } finally {
            metrics.recordLatency("conversion", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.REQUEST_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    public Optional<ConversionDebit> find(UUID requestId) {
        return debitService.find(requestId);
    }

    /**
     * Releases reservations older than the reservation timeout.
     *
     * @return number released
     */
    public int releaseStaleReservations(int limit) {
        Instant cutoff = Instant.now().minus(reservationTimeout);
        List<ConversionDebit> stale = debitService.findReservedBefore(cutoff, limit);
        int released = 0;
        for (ConversionDebit debit : stale) {
            try {
                debitService.release(debit.getRequestId(), "reservation timed out");
                released++;
                log.warn("Stale reservation released: requestId={}, accountId={}, amount={}",
                        debit.getRequestId(), debit.getAccountId(), debit.getReservedAmount());
            } catch (IllegalStateException e) {
                log.info("Reservation resolved while sweeping: requestId={}", debit.getRequestId());
            } catch (RuntimeException e) {
                log.error("Failed to release stale reservation: requestId={}, error={}",
                        debit.getRequestId(), e.getMessage());
            }
        }
        if (released > 0) {
            metrics.recordReservationsReleased("timeout", released);
        }
        return released;
    }

    private ConversionDebit complete(ConversionDebit reserved) {
        UUID requestId = reserved.getRequestId();
        String confirmationId;
        try {
            confirmationId = callProvider(reserved.getInstallationId());
        } catch (InvalidInstallationIdException e) {
            metrics.recordConversion("rejected");
            return release(requestId, "rejected: " + e.getMessage());
        } catch (ProviderUnavailableException e) {
            metrics.recordConversion("provider_unavailable");
            return release(requestId, "provider unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Conversion failed unexpectedly, releasing reservation: error={}", e.getMessage(), e);
            metrics.recordConversion("error");
            release(requestId, "internal error");
            throw e;
        }

        try {
            ConversionDebit finalized = retryExecutor.execute("conversion_finalize", requestId.toString(),
                () -> debitService.finalizeDebit(requestId, confirmationId));
            metrics.recordConversion("success");
            log.info("Conversion completed");
            return finalized;
        } catch (ReservationExpiredException e) {
            metrics.recordConversion("expired");
            log.error("Provider answered after the reservation was released, conversion not charged: confirmationId={}",
                    confirmationId);
            throw e;
        }
    }

    private String callProvider(String installationId) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return provider.convert(installationId);
            } catch (ProviderUnavailableException e) {
                if (!providerRetry.allowsRetryAfter(attempt)) {
                    log.warn("Conversion provider unavailable after {} attempts: error={}", attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = providerRetry.backoffAfter(attempt);
                log.warn("Conversion provider unavailable, retrying: attempt={}, backoff={}ms, error={}",
                        attempt, backoff.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ProviderUnavailableException("Conversion interrupted", interrupted);
                }
            }
        }
    }

    private ConversionDebit release(UUID requestId, String reason) {
        ConversionDebit released = retryExecutor.execute("conversion_release", requestId.toString(),
            () -> debitService.release(requestId, reason));
        metrics.recordReservationsReleased("failure", 1);
        log.info("Conversion reservation released: reason={}", reason);
        return released;
    }

    private ConversionDebit replay(ConversionDebit previous, UUID callerId, String idempotencyKey) {
        if (!previous.getAccountId().equals(callerId)) {
            metrics.recordConversion("key_conflict");
            log.warn("Idempotency key reused by another account: requestId={}, ownerAccount={}, callerAccount={}",
                    previous.getRequestId(), previous.getAccountId(), callerId);
            throw new IdempotencyKeyConflictException(idempotencyKey);
        }
        metrics.recordIdempotencyHit();
        log.info("Conversion request replayed: requestId={}, status={}",
                previous.getRequestId(), previous.getStatus());
        return previous;
    }

    private Optional<ConversionDebit> findPrevious(String idempotencyKey) {
        return idempotencyService.lookup(idempotencyKey).flatMap(debitService::find);
    }
}
