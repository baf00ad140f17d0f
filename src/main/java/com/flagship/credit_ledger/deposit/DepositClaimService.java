package com.flagship.credit_ledger.deposit;

import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Persistence for deposit claims.
 *
 * Every transition locks the claim row, re-reads it and applies the domain
 * transition, so two workers processing the same hash cannot both move it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositClaimService {

    static final String AGGREGATE_TYPE = "DepositClaim";

    private final DepositClaimRepository repository;
    private final OutboxService outboxService;

    /**
     * Registers a claim or returns the one already stored for the hash.
     * Not transactional: a concurrent registration loses on the unique constraint
     * and reads the winner's row.
     */
    public DepositClaim register(String txHash, UUID accountId, BigDecimal claimedAmount, BigDecimal expectedAmount) {
        Optional<DepositClaimEntity> existing = repository.findByTxHash(txHash);
        if (existing.isPresent()) {
            return existing.get().toDomain();
        }
        try {
            DepositClaim claim = DepositClaim.create(txHash, accountId, claimedAmount, expectedAmount);
            DepositClaimEntity saved = repository.saveAndFlush(DepositClaimEntity.fromDomain(claim));
            log.info("Deposit claim registered: txHash={}, accountId={}, claimedAmount={}, expectedAmount={}",
                    txHash, accountId, claimedAmount, expectedAmount);
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            return repository.findByTxHash(txHash)
                .map(DepositClaimEntity::toDomain)
                .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<DepositClaim> findByTxHash(String txHash) {
        return repository.findByTxHash(txHash).map(DepositClaimEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<DepositClaim> findByStatus(DepositClaimStatus status, int limit) {
        return repository.findByStatus(status, PageRequest.of(0, limit))
            .stream()
            .map(DepositClaimEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<DepositClaim> findByAccount(UUID accountId, int limit) {
        return repository.findByAccountIdOrderByCreatedAtDesc(accountId, PageRequest.of(0, limit))
            .stream()
            .map(DepositClaimEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countAwaitingReview() {
        return repository.countAwaitingReview(DepositClaimStatus.PENDING);
    }

    @Transactional
    public DepositClaim markVerified(String txHash, BigDecimal amount, int attempts) {
        return transition(txHash, claim -> claim.markVerified(amount, attempts), true);
    }

    @Transactional
    public DepositClaim reject(String txHash, String reason, int attempts) {
        return transition(txHash, claim -> claim.reject(reason, attempts), true);
    }

    @Transactional
    public DepositClaim recordInconclusive(String txHash, String error, int attempts, boolean needsReview) {
        return transition(txHash, claim -> claim.recordInconclusive(error, attempts, needsReview), false);
    }

    /**
     * Locks the claim row for the credit step. The caller owns the transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public DepositClaim lockForCredit(String txHash) {
        return repository.findByTxHashForUpdate(txHash)
            .map(DepositClaimEntity::toDomain)
            .orElseThrow(() -> new IllegalArgumentException("Deposit claim not found: " + txHash));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public DepositClaim markCredited(String txHash) {
        return transition(txHash, DepositClaim::markCredited, true);
    }

    private DepositClaim transition(String txHash, UnaryOperator<DepositClaim> change, boolean publish) {
        DepositClaimEntity entity = repository.findByTxHashForUpdate(txHash)
            .orElseThrow(() -> new IllegalArgumentException("Deposit claim not found: " + txHash));

        DepositClaim updated = change.apply(entity.toDomain());
        entity.updateFromDomain(updated);
        DepositClaim saved = repository.save(entity).toDomain();

        if (publish) {
            outboxService.saveEvent(AGGREGATE_TYPE, saved.getAccountId(), DepositClaimStatusChangedEvent.EVENT_TYPE,
                    DepositClaimStatusChangedEvent.from(saved));
        }
        log.debug("Deposit claim {} now {}", txHash, saved.getStatus());
        return saved;
    }
}
