package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.ledger.event.BalanceChangedEvent;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger store: balances plus the append-only event log behind them.
 *
 * This service enforces the core invariants:
 * 1. A balance never goes negative
 * 2. Every balance change appends exactly one LedgerEvent in the same transaction
 * 3. (kind, external reference) identifies an operation: repeating it returns
 *    the original event and changes nothing
 * 4. Mutations on one account are totally ordered by the account row lock
 *
 * Every mutation also writes a BalanceChanged event to the outbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String AGGREGATE_TYPE = "Account";

    /**
     * Decimal places of every stored amount and balance (NUMERIC(19, 4) columns).
     */
    public static final int AMOUNT_SCALE = 4;

    private final AccountRepository accountRepository;
    private final LedgerEventRepository eventRepository;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Credits an account.
     *
     * @param accountId account to credit
     * @param asset balance to credit
     * @param amount positive amount
     * @param kind kind of credit (deposit, voucher, refund, ...)
     * @param reference external reference; with the kind, the idempotency key
     * @return the recorded event, or the previously recorded one for a repeated (kind, reference)
     */
    @Transactional
    public LedgerEvent credit(UUID accountId, Asset asset, BigDecimal amount,
                              LedgerEventKind kind, String reference) {
        return credit(accountId, asset, amount, kind, reference, null);
    }

    @Transactional
    public LedgerEvent credit(UUID accountId, Asset asset, BigDecimal amount,
                              LedgerEventKind kind, String reference, String description) {
        amount = validate(amount, reference);
        if (!kind.isCredit()) {
            throw new IllegalArgumentException("Kind " + kind + " cannot be used for a credit");
        }

        AccountEntity account = lockAccount(accountId);

        Optional<LedgerEvent> existing = findExisting(account, asset, kind, reference);
        if (existing.isPresent()) {
            ledgerMetrics.recordDuplicatePosting(kind.name());
            return existing.get();
        }

        return append(account, asset, amount, kind, reference, description);
    }

    /**
     * Debits an account.
     *
     * @throws InsufficientFundsException if the balance is less than the amount; nothing is changed
     * @throws AccountSuspendedException if the account is suspended
     */
    @Transactional
    public LedgerEvent debit(UUID accountId, Asset asset, BigDecimal amount,
                             LedgerEventKind kind, String reference) {
        return debit(accountId, asset, amount, kind, reference, null);
    }

    @Transactional
    public LedgerEvent debit(UUID accountId, Asset asset, BigDecimal amount,
                             LedgerEventKind kind, String reference, String description) {
        amount = validate(amount, reference);
        if (kind != LedgerEventKind.DEBIT && kind != LedgerEventKind.ADMIN_ADJUSTMENT) {
            throw new IllegalArgumentException("Kind " + kind + " cannot be used for a debit");
        }

        AccountEntity account = lockAccount(accountId);

        Optional<LedgerEvent> existing = findExisting(account, asset, kind, reference);
        if (existing.isPresent()) {
            ledgerMetrics.recordDuplicatePosting(kind.name());
            return existing.get();
        }

        if (account.getStatus() == AccountStatus.SUSPENDED) {
            ledgerMetrics.recordPosting(asset.name(), kind.name(), "suspended");
            throw new AccountSuspendedException(accountId);
        }

        BigDecimal available = account.balanceOf(asset);
        if (available.compareTo(amount) < 0) {
            ledgerMetrics.recordPosting(asset.name(), kind.name(), "insufficient_funds");
            log.info("Debit rejected: accountId={}, asset={}, available={}, requested={}, reference={}",
                    accountId, asset, available, amount, reference);
            throw new InsufficientFundsException(accountId, asset, available, amount);
        }

        return append(account, asset, amount.negate(), kind, reference, description);
    }

    @Transactional(readOnly = true)
    public BigDecimal balance(UUID accountId, Asset asset) {
        return accountRepository.findById(accountId)
            .map(account -> account.balanceOf(asset))
            .orElseThrow(() -> new AccountNotFoundException(accountId.toString()));
    }

    /**
     * Newest events first.
     */
    @Transactional(readOnly = true)
    public List<LedgerEvent> history(UUID accountId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return eventRepository.findRecent(accountId, PageRequest.of(0, limit))
            .stream()
            .map(LedgerEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEvent> findEvent(LedgerEventKind kind, String reference) {
        return eventRepository.findByKindAndExternalReference(kind, reference)
            .map(LedgerEventEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> eventsForReference(String reference) {
        return eventRepository.findByExternalReferenceOrderBySequenceNumberAsc(reference)
            .stream()
            .map(LedgerEventEntity::toDomain)
            .toList();
    }

    /**
     * Checks that the stored balance equals the sum of the account's events for the asset.
     */
    @Transactional(readOnly = true)
    public boolean isConserved(UUID accountId, Asset asset) {
        BigDecimal stored = balance(accountId, asset);
        BigDecimal summed = eventRepository.sumAmounts(accountId, asset);
        return stored.compareTo(summed) == 0;
    }

    private AccountEntity lockAccount(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId.toString()));
    }

    private Optional<LedgerEvent> findExisting(AccountEntity account, Asset asset,
                                               LedgerEventKind kind, String reference) {
        return eventRepository.findByKindAndExternalReference(kind, reference)
            .map(LedgerEventEntity::toDomain)
            .map(event -> {
                if (!event.getAccountId().equals(account.getId()) || event.getAsset() != asset) {
                    throw new IllegalStateException(String.format(
                        "Reference %s already recorded as %s for another account or asset", reference, kind));
                }
                log.info("Ledger posting already recorded, returning existing event: kind={}, reference={}, eventId={}",
                        kind, reference, event.getId());
                return event;
            });
    }

    private LedgerEvent append(AccountEntity account, Asset asset, BigDecimal signedAmount,
                               LedgerEventKind kind, String reference, String description) {
        long sequence = account.apply(asset, signedAmount);
        accountRepository.save(account);

        LedgerEventEntity saved = eventRepository.save(LedgerEventEntity.record(
            account.getId(),
            asset,
            kind,
            signedAmount,
            account.balanceOf(asset),
            reference,
            sequence,
            description
        ));
        LedgerEvent event = saved.toDomain();

        outboxService.saveEvent(AGGREGATE_TYPE, account.getId(), BalanceChangedEvent.EVENT_TYPE,
                BalanceChangedEvent.from(event));

        ledgerMetrics.recordPosting(asset.name(), kind.name(), "success");
        log.info("Ledger event appended: accountId={}, asset={}, kind={}, amount={}, balance={}, reference={}, seq={}",
                account.getId(), asset, kind, signedAmount, event.getResultingBalance(), reference, sequence);
        return event;
    }

    /**
     * Truncates an amount to the ledger's precision. Callers holding amounts of
     * higher precision (on-chain transfers) use this before posting; fractions
     * below the precision are never credited.
     */
    public static BigDecimal toLedgerScale(BigDecimal amount) {
        return amount.setScale(AMOUNT_SCALE, RoundingMode.DOWN);
    }

    /**
     * @return the amount at the ledger's scale, exactly equal to the input
     */
    private BigDecimal validate(BigDecimal amount, String reference) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("External reference is required");
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new IllegalArgumentException(String.format(
                "Amount %s has more than %d decimal places", amount.toPlainString(), AMOUNT_SCALE));
        }
        return amount.setScale(AMOUNT_SCALE, RoundingMode.UNNECESSARY);
    }
}
