package com.flagship.credit_ledger.coordinator;

import com.flagship.credit_ledger.deposit.DepositClaim;
import com.flagship.credit_ledger.deposit.DepositClaimConflictException;
import com.flagship.credit_ledger.deposit.DepositClaimService;
import com.flagship.credit_ledger.deposit.DepositClaimStatus;
import com.flagship.credit_ledger.deposit.DepositVerifier;
import com.flagship.credit_ledger.deposit.UnderpaidPolicy;
import com.flagship.credit_ledger.deposit.Verdict;
import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountService;
import com.flagship.credit_ledger.ledger.LedgerService;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.pricing.PackageOrderService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;

/**
 * Drives deposit claims through PENDING -> VERIFIED -> CREDITED (or REJECTED).
 *
 * Not transactional. Verification runs with no transaction and no locks; each
 * state change and the credit step are separate transactions. A claim that
 * reached VERIFIED is credited with unbounded storage retries, keyed by the
 * transaction hash, so re-running any step never credits twice.
 */
@Service
@Slf4j
public class DepositSettlementService {

    private final AccountService accountService;
    private final DepositClaimService claimService;
    private final DepositVerifier verifier;
    private final DepositCreditStep creditStep;
    private final StorageRetryExecutor retryExecutor;
    private final PackageOrderService orderService;
    private final LedgerMetrics metrics;
    private final String walletAddress;
    private final BigDecimal minimumAmount;
    private final UnderpaidPolicy underpaidPolicy;

    public DepositSettlementService(AccountService accountService,
                                    DepositClaimService claimService,
                                    DepositVerifier verifier,
                                    DepositCreditStep creditStep,
                                    StorageRetryExecutor retryExecutor,
                                    PackageOrderService orderService,
                                    LedgerMetrics metrics,
                                    @Value("${deposit.wallet-address}") String walletAddress,
                                    @Value("${deposit.minimum-amount:5.00}") BigDecimal minimumAmount,
                                    @Value("${deposit.underpaid-policy:CREDIT_ACTUAL}") UnderpaidPolicy underpaidPolicy) {
        this.accountService = accountService;
        this.claimService = claimService;
        this.verifier = verifier;
        this.creditStep = creditStep;
        this.retryExecutor = retryExecutor;
        this.orderService = orderService;
        this.metrics = metrics;
        this.walletAddress = walletAddress;
        this.minimumAmount = minimumAmount;
        this.underpaidPolicy = underpaidPolicy;
    }

    /**
     * Registers a claim for the user and processes it.
     *
     * @param claimedAmount amount the user says was sent, or null
     * @throws DepositClaimConflictException if another account already claimed the hash
     */
    public DepositClaim submitClaim(String userKey, String txHash, BigDecimal claimedAmount) {
        String hash = normalizeHash(txHash);
        if (claimedAmount != null) {
            claimedAmount = LedgerService.toLedgerScale(claimedAmount);
            if (claimedAmount.signum() <= 0) {
                throw new IllegalArgumentException("Claimed amount must be positive");
            }
        }

        Account account = accountService.getOrCreate(userKey);
        BigDecimal expected = claimedAmount != null
            ? claimedAmount
            : orderService.requiredPaymentFor(account.getId())
                .filter(required -> required.signum() > 0)
                .orElse(null);

        DepositClaim claim = claimService.register(hash, account.getId(), claimedAmount, expected);
        if (!claim.getAccountId().equals(account.getId())) {
            log.warn("Deposit claim conflict: txHash={}, claimingAccount={}, owningAccount={}",
                    hash, account.getId(), claim.getAccountId());
            throw new DepositClaimConflictException(hash);
        }
        return process(hash);
    }

    /**
     * Advances a claim as far as it can go now. Safe to call repeatedly and concurrently.
     */
    public DepositClaim process(String txHash) {
        String hash = normalizeHash(txHash);
        MDC.put(CorrelationContext.TX_HASH_MDC_KEY, hash);
        long startTime = System.currentTimeMillis();
        try {
            DepositClaim claim = claimService.findByTxHash(hash)
                .orElseThrow(() -> new IllegalArgumentException("Deposit claim not found: " + hash));
            MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, claim.getAccountId().toString());

            if (claim.isTerminal()) {
                log.debug("Deposit claim already resolved: status={}", claim.getStatus());
                return claim;
            }
            if (claim.getStatus() == DepositClaimStatus.VERIFIED) {
                return credit(claim);
            }

            Verdict verdict = verifier.verify(hash, walletAddress, claim.getExpectedAmount());
            return apply(claim, verdict);
        } finally {
            metrics.recordLatency("deposit_process", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TX_HASH_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private DepositClaim apply(DepositClaim claim, Verdict verdict) {
        String hash = claim.getTxHash();
        try {
            switch (verdict.getOutcome()) {
                case CONFIRMED:
                    return accept(claim, verdict);
                case UNDERPAID:
                    if (underpaidPolicy == UnderpaidPolicy.REJECT) {
                        return resolveRejected(hash, String.format("underpaid: received %s, expected %s",
                            verdict.getActualAmount(), claim.getExpectedAmount()), verdict.getAttempts());
                    }
                    log.info("Underpaid deposit accepted at actual amount: actual={}, expected={}",
                            verdict.getActualAmount(), claim.getExpectedAmount());
                    return accept(claim, verdict);
                case NOT_FOUND:
                    return resolveRejected(hash, verdict.getDetail(), verdict.getAttempts());
                case PENDING:
                    return claimService.recordInconclusive(hash, verdict.getDetail(), verdict.getAttempts(), false);
                case PROVIDER_ERROR:
                    log.error("Deposit verification exhausted retries, claim left pending for review: error={}",
                            verdict.getDetail());
                    return claimService.recordInconclusive(hash, verdict.getDetail(), verdict.getAttempts(), true);
                default:
                    throw new IllegalStateException("Unhandled verdict " + verdict.getOutcome());
            }
        } catch (IllegalStateException e) {
            // Another worker moved the claim while this one was verifying.
            DepositClaim current = claimService.findByTxHash(hash).orElseThrow(() -> e);
            if (current.getStatus() == DepositClaimStatus.PENDING) {
                throw e;
            }
            log.info("Deposit claim advanced concurrently: status={}", current.getStatus());
            return current.getStatus() == DepositClaimStatus.VERIFIED ? credit(current) : current;
        }
    }

    private DepositClaim accept(DepositClaim claim, Verdict verdict) {
        BigDecimal actual = verdict.getActualAmount();
        if (actual.compareTo(minimumAmount) < 0) {
            return resolveRejected(claim.getTxHash(),
                String.format("amount %s is below the minimum deposit of %s", actual, minimumAmount),
                verdict.getAttempts());
        }
        DepositClaim verified = claimService.markVerified(claim.getTxHash(), actual, verdict.getAttempts());
        return credit(verified);
    }

    private DepositClaim resolveRejected(String txHash, String reason, int attempts) {
        DepositClaim rejected = claimService.reject(txHash, reason, attempts);
        metrics.recordClaimResolved(DepositClaimStatus.REJECTED.name());
        log.info("Deposit claim rejected: reason={}", reason);
        return rejected;
    }

    private DepositClaim credit(DepositClaim claim) {
        String hash = claim.getTxHash();
        DepositClaim credited = retryExecutor.execute("deposit_credit", hash,
            () -> creditStep.creditVerifiedClaim(hash));
        metrics.recordClaimResolved(DepositClaimStatus.CREDITED.name());
        log.info("Deposit credited: amount={}", credited.getVerifiedAmount());

        completeOpenOrder(credited.getAccountId());
        return credited;
    }

    private void completeOpenOrder(UUID accountId) {
        try {
            orderService.completeIfFunded(accountId);
        } catch (RuntimeException e) {
            log.warn("Open package order could not be completed after deposit: accountId={}, error={}",
                    accountId, e.getMessage());
        }
    }

    static String normalizeHash(String txHash) {
        if (txHash == null || txHash.isBlank()) {
            throw new IllegalArgumentException("Transaction hash is required");
        }
        return txHash.trim().toLowerCase(Locale.ROOT);
    }
}
