package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.ledger.event.AccountStatusChangedEvent;
import com.flagship.credit_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Account lifecycle: creation on first interaction, suspension and reactivation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final OutboxService outboxService;

    /**
     * Returns the account for a user key, creating it on first interaction.
     *
     * Must not run inside a caller's transaction: a concurrent first interaction
     * surfaces as a unique-constraint violation, which is resolved by reading
     * the row the other request created.
     */
    public Account getOrCreate(String userKey) {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("User key is required");
        }
        String key = userKey.trim();

        Optional<AccountEntity> existing = accountRepository.findByUserKey(key);
        if (existing.isPresent()) {
            return existing.get().toDomain();
        }

        try {
            AccountEntity created = accountRepository.saveAndFlush(AccountEntity.open(key));
            log.info("Account created: accountId={}, userKey={}", created.getId(), key);
            return created.toDomain();
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent account creation for userKey={}, reading existing row", key);
            return accountRepository.findByUserKey(key)
                .map(AccountEntity::toDomain)
                .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByUserKey(String userKey) {
        return accountRepository.findByUserKey(userKey.trim()).map(AccountEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Account require(String userKey) {
        return findByUserKey(userKey).orElseThrow(() -> new AccountNotFoundException(userKey));
    }

    @Transactional(readOnly = true)
    public Account require(UUID accountId) {
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new AccountNotFoundException(accountId.toString()));
    }

    @Transactional
    public Account suspend(UUID accountId) {
        return changeStatus(accountId, AccountStatus.SUSPENDED);
    }

    @Transactional
    public Account reactivate(UUID accountId) {
        return changeStatus(accountId, AccountStatus.ACTIVE);
    }

    private Account changeStatus(UUID accountId, AccountStatus status) {
        AccountEntity account = accountRepository.findByIdForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId.toString()));

        if (account.getStatus() == status) {
            return account.toDomain();
        }

        account.changeStatus(status);
        accountRepository.save(account);

        outboxService.saveEvent(LedgerService.AGGREGATE_TYPE, accountId, AccountStatusChangedEvent.EVENT_TYPE,
                AccountStatusChangedEvent.of(accountId, account.getUserKey(), status.name()));

        log.info("Account status changed: accountId={}, status={}", accountId, status);
        return account.toDomain();
    }
}
