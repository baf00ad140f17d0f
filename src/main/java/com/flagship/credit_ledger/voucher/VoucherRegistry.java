package com.flagship.credit_ledger.voucher;

import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerEventKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns voucher persistence and the single-use guarantee.
 *
 * {@link #redeem(String, UUID)} reads the voucher under a row lock and flips it
 * to USED in the same transaction, so concurrent redemptions of one code are
 * serialized: exactly one succeeds and the rest see USED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoucherRegistry {

    static final int MAX_BATCH_SIZE = 100;

    private final VoucherRepository repository;
    private final VoucherCodeGenerator codeGenerator;

    /**
     * Atomically marks the voucher used by the account and returns its value.
     *
     * @throws VoucherNotFoundException if the code does not exist or is malformed
     * @throws VoucherAlreadyUsedException if the voucher was already redeemed
     * @throws VoucherExpiredException if the voucher is past its expiry
     */
    @Transactional
    public VoucherValue redeem(String code, UUID accountId) {
        String normalized = codeGenerator.normalize(code);
        if (normalized == null) {
            throw new VoucherNotFoundException(String.valueOf(code));
        }

        VoucherEntity entity = repository.findByCodeForUpdate(normalized)
            .orElseThrow(() -> new VoucherNotFoundException(normalized));

        Voucher redeemed = entity.toDomain().redeem(accountId, Instant.now());
        entity.markRedeemed(redeemed);
        repository.save(entity);

        log.info("Voucher redeemed: code={}, accountId={}, asset={}, amount={}",
                normalized, accountId, redeemed.getValue().getAsset(), redeemed.getValue().getAmount());
        return redeemed.getValue();
    }

    @Transactional(readOnly = true)
    public Optional<Voucher> find(String code) {
        String normalized = codeGenerator.normalize(code);
        if (normalized == null) {
            return Optional.empty();
        }
        return repository.findByCode(normalized).map(VoucherEntity::toDomain);
    }

    /**
     * Inspects a voucher without redeeming it.
     */
    @Transactional(readOnly = true)
    public Voucher validate(String code) {
        Voucher voucher = find(code).orElseThrow(() -> new VoucherNotFoundException(String.valueOf(code)));
        if (voucher.isUsed()) {
            throw new VoucherAlreadyUsedException(voucher.getCode());
        }
        if (voucher.isExpired(Instant.now())) {
            throw new VoucherExpiredException(voucher.getCode());
        }
        return voucher;
    }

    /**
     * Creates {@code count} vouchers of the same value with generated codes.
     */
    @Transactional
    public List<Voucher> createBatch(int count, VoucherValue value, String prefix, Instant expiresAt, String createdBy) {
        if (count < 1 || count > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Voucher batch size must be between 1 and " + MAX_BATCH_SIZE);
        }
        requireCreator(createdBy);

        Set<String> codes = new HashSet<>();
        List<Voucher> created = new ArrayList<>(count);
        while (created.size() < count) {
            String code = codeGenerator.generate(prefix);
            if (!codes.add(code) || repository.existsByCode(code)) {
                continue;
            }
            Voucher voucher = Voucher.issue(code, value, expiresAt, createdBy);
            created.add(repository.save(VoucherEntity.fromDomain(voucher)).toDomain());
        }

        log.info("Voucher batch created: count={}, asset={}, amount={}, expiresAt={}, createdBy={}",
                count, value.getAsset(), value.getAmount(), expiresAt, createdBy);
        return created;
    }

    @Transactional
    public Voucher createWithCode(String code, VoucherValue value, Instant expiresAt, String createdBy) {
        String normalized = codeGenerator.requireValidCustomCode(code);
        requireCreator(createdBy);
        if (repository.existsByCode(normalized)) {
            throw new IllegalArgumentException("Voucher code already exists: " + normalized);
        }
        Voucher voucher = Voucher.issue(normalized, value, expiresAt, createdBy);
        Voucher saved = repository.save(VoucherEntity.fromDomain(voucher)).toDomain();
        log.info("Voucher created: code={}, asset={}, amount={}, createdBy={}",
                normalized, value.getAsset(), value.getAmount(), createdBy);
        return saved;
    }

    @Transactional(readOnly = true)
    public VoucherStats stats() {
        Instant now = Instant.now();
        long total = repository.count();
        long used = repository.countByStatus(VoucherStatus.USED);
        long expired = repository.countExpired(VoucherStatus.UNUSED, now);

        Map<Asset, BigDecimal> outstanding = new EnumMap<>(Asset.class);
        for (Asset asset : Asset.values()) {
            outstanding.put(asset, BigDecimal.ZERO);
        }
        for (Object[] row : repository.sumOutstandingByAsset(VoucherStatus.UNUSED, now)) {
            outstanding.put((Asset) row[0], (BigDecimal) row[1]);
        }

        return new VoucherStats(total, used, total - used - expired, expired, outstanding);
    }

    /**
     * Used vouchers with no VOUCHER_CREDIT event, oldest redemption first.
     */
    @Transactional(readOnly = true)
    public List<Voucher> findRedeemedWithoutCredit(int limit) {
        return repository.findRedeemedWithoutCredit(VoucherStatus.USED, LedgerEventKind.VOUCHER_CREDIT,
                PageRequest.of(0, limit))
            .stream()
            .map(VoucherEntity::toDomain)
            .toList();
    }

    private void requireCreator(String createdBy) {
        if (createdBy == null || createdBy.isBlank()) {
            throw new IllegalArgumentException("Voucher creator is required");
        }
    }
}
