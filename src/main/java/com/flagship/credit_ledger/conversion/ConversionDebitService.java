package com.flagship.credit_ledger.conversion;

import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import com.flagship.credit_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reservation store for conversions.
 *
 * Each method is one transaction. The provider call happens between
 * {@link #reserve} and {@link #finalizeDebit}/{@link #release}, never inside one.
 * Row lock order is debit row, then account row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversionDebitService {

    private final ConversionDebitRepository debitRepository;
    private final LedgerService ledgerService;

    /**
     * Debits the reservation amount and records the RESERVED debit.
     *
     * @throws com.flagship.credit_ledger.ledger.InsufficientFundsException if the credit balance is short; nothing is recorded
     */
    @Transactional
    public ConversionDebit reserve(UUID requestId, UUID accountId, String installationId,
                                   BigDecimal amount, String idempotencyKey) {
        ConversionDebit debit = ConversionDebit.reserve(requestId, accountId, installationId, amount, idempotencyKey);

        ledgerService.debit(accountId, Asset.CREDITS, amount, LedgerEventKind.DEBIT, debit.ledgerReference(),
                "conversion reservation");
        debitRepository.saveAndFlush(ConversionDebitEntity.fromDomain(debit));

        log.info("Conversion reserved: requestId={}, accountId={}, amount={}", requestId, accountId, amount);
        return debit;
    }

    /**
     * Marks the reservation consumed. Repeating it is a no-op.
     *
     * @throws ReservationExpiredException if the reservation was released first
     */
    @Transactional
    public ConversionDebit finalizeDebit(UUID requestId, String confirmationId) {
        ConversionDebitEntity entity = lock(requestId);
        ConversionDebit debit = entity.toDomain();

        if (debit.getStatus() == ConversionDebitStatus.FINALIZED) {
            return debit;
        }
        if (debit.getStatus() == ConversionDebitStatus.RELEASED) {
            throw new ReservationExpiredException(requestId);
        }

        ConversionDebit finalized = debit.finalizeWith(confirmationId);
        entity.updateFromDomain(finalized);
        debitRepository.save(entity);

        log.info("Conversion finalized: requestId={}, accountId={}", requestId, debit.getAccountId());
        return finalized;
    }

    /**
     * Returns the reserved amount with a REFUND credit and marks the reservation released.
     * Repeating it is a no-op.
     *
     * @throws IllegalStateException if the reservation was already finalized
     */
    @Transactional
    public ConversionDebit release(UUID requestId, String reason) {
        ConversionDebitEntity entity = lock(requestId);
        ConversionDebit debit = entity.toDomain();

        if (debit.getStatus() == ConversionDebitStatus.RELEASED) {
            return debit;
        }

        ConversionDebit released = debit.release(reason);
        ledgerService.credit(debit.getAccountId(), Asset.CREDITS, debit.getReservedAmount(),
                LedgerEventKind.REFUND, debit.ledgerReference(), "conversion release: " + reason);
        entity.updateFromDomain(released);
        debitRepository.save(entity);

        log.info("Conversion released: requestId={}, accountId={}, reason={}",
                requestId, debit.getAccountId(), reason);
        return released;
    }

    @Transactional(readOnly = true)
    public Optional<ConversionDebit> find(UUID requestId) {
        return debitRepository.findById(requestId).map(ConversionDebitEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ConversionDebit> findReservedBefore(Instant cutoff, int limit) {
        return debitRepository.findByStatusCreatedBefore(ConversionDebitStatus.RESERVED, cutoff, PageRequest.of(0, limit))
            .stream()
            .map(ConversionDebitEntity::toDomain)
            .toList();
    }

    private ConversionDebitEntity lock(UUID requestId) {
        return debitRepository.findByIdForUpdate(requestId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown conversion request " + requestId));
    }
}
